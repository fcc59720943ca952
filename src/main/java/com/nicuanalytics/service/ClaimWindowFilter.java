package com.nicuanalytics.service;

import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.RollupWindow;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ClaimWindowFilter {

    public List<Claim> filter(List<Claim> claims, RollupWindow window) {
        return claims.stream()
            .filter(claim -> !claim.getServiceFromDate().isBefore(window.getBirthWindowStart())
                && !claim.getServiceFromDate().isAfter(window.getBirthWindowEnd()))
            .filter(claim -> claim.getPaidDate() == null || !claim.getPaidDate().isAfter(window.getRunoutEnd()))
            .toList();
    }
}
