package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.exception.InsufficientClaimsHistoryException;
import com.nicuanalytics.exception.RollupInputException;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.RollupWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BirthWindowCalculator {

    private final RollupSettings settings;

    public RollupWindow derive(List<Claim> claims) {
        LocalDate min = null;
        LocalDate max = null;
        for (Claim claim : claims) {
            LocalDate from = claim.getServiceFromDate();
            if (from == null) {
                continue;
            }
            if (min == null || from.isBefore(min)) {
                min = from;
            }
            if (max == null || from.isAfter(max)) {
                max = from;
            }
        }
        if (min == null) {
            throw new InsufficientClaimsHistoryException(
                "Service-from date range is empty. Cannot determine birth window.");
        }

        int months = monthsCovered(min, max);
        if (months < settings.getMinHistoryMonths()) {
            throw new InsufficientClaimsHistoryException(String.format(
                "Only %d months of claims available (%s to %s). Minimum %d months required.",
                months, min, max, settings.getMinHistoryMonths()));
        }

        LocalDate runoutEnd = max.withDayOfMonth(1).minusDays(1);
        LocalDate runoutStart = runoutEnd.minusMonths(settings.getRunoutWindowMonths()).plusDays(1);
        LocalDate birthWindowEnd = runoutStart.minusDays(1);
        LocalDate birthWindowStart = birthWindowEnd.minusMonths(settings.getBirthWindowMonths()).plusDays(1);
        LocalDate birthWindowMid = birthWindowStart.plusMonths(settings.getBirthWindowMonths() / 2);

        log.info("Derived birth window | start={} | mid={} | end={} | runoutEnd={}",
            birthWindowStart, birthWindowMid, birthWindowEnd, runoutEnd);
        return RollupWindow.builder()
            .birthWindowStart(birthWindowStart)
            .birthWindowMid(birthWindowMid)
            .birthWindowEnd(birthWindowEnd)
            .runoutEnd(runoutEnd)
            .build();
    }

    public RollupWindow validate(RollupWindow window) {
        if (window.getBirthWindowStart() == null || window.getBirthWindowEnd() == null
                || window.getRunoutEnd() == null) {
            throw new RollupInputException("Birth window start, end and runout end must all be provided.");
        }
        RollupWindow resolved = window;
        if (window.getBirthWindowMid() == null) {
            resolved = RollupWindow.builder()
                .birthWindowStart(window.getBirthWindowStart())
                .birthWindowMid(window.getBirthWindowStart().plusMonths(settings.getBirthWindowMonths() / 2))
                .birthWindowEnd(window.getBirthWindowEnd())
                .runoutEnd(window.getRunoutEnd())
                .build();
        }
        if (resolved.getBirthWindowMid().isBefore(resolved.getBirthWindowStart())
                || resolved.getBirthWindowEnd().isBefore(resolved.getBirthWindowMid())
                || resolved.getRunoutEnd().isBefore(resolved.getBirthWindowEnd())) {
            throw new RollupInputException(String.format(
                "Window dates out of order: start=%s mid=%s end=%s runoutEnd=%s",
                resolved.getBirthWindowStart(), resolved.getBirthWindowMid(),
                resolved.getBirthWindowEnd(), resolved.getRunoutEnd()));
        }
        return resolved;
    }

    static int monthsCovered(LocalDate min, LocalDate max) {
        return (max.getYear() - min.getYear()) * 12 + (max.getMonthValue() - min.getMonthValue()) + 1;
    }
}
