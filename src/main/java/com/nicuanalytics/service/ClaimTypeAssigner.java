package com.nicuanalytics.service;

import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.ClaimType;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
public class ClaimTypeAssigner {

    private static final Set<String> ER_PROCEDURE_CODES = Set.of(
        "99281", "99282", "99283", "99284", "99285", "99286", "99287", "99288");

    public List<Claim> assign(List<Claim> claims) {
        return claims.stream()
            .map(claim -> claim.getClaimType() != null
                ? claim
                : claim.toBuilder().claimType(classify(claim)).build())
            .toList();
    }

    ClaimType classify(Claim claim) {
        String pos = claim.getPlaceOfService();
        String revenueCode = claim.getRevenueCode();
        String cpt = claim.getProfessionalProcedureCode();

        if ("21".equals(pos)
                || between(revenueCode, "0100", "0210")
                || "0987".equals(revenueCode)
                || between(cpt, "99221", "99239")
                || between(cpt, "99251", "99255")
                || between(cpt, "99261", "99263")
                || (claim.getDrgCode() != null && !claim.getDrgCode().isBlank())) {
            return ClaimType.INPATIENT;
        }
        if ("23".equals(pos)
                || (cpt != null && ER_PROCEDURE_CODES.contains(cpt))
                || (revenueCode != null && revenueCode.startsWith("045"))
                || "0981".equals(revenueCode)) {
            return ClaimType.EMERGENCY;
        }
        return ClaimType.OUTPATIENT;
    }

    // inclusive, compared as text the way the code tables store them
    private static boolean between(String code, String low, String high) {
        return code != null && code.compareTo(low) >= 0 && code.compareTo(high) <= 0;
    }
}
