package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.CodeFeatures;
import com.nicuanalytics.model.ContractType;
import com.nicuanalytics.model.CostFeatures;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.NewbornRecord;
import com.nicuanalytics.model.NewbornRollupRecord;
import com.nicuanalytics.model.NicuRecord;
import com.nicuanalytics.model.NicuRollupRecord;
import com.nicuanalytics.model.ProfessionalFees;
import com.nicuanalytics.model.ProviderAttribution;
import com.nicuanalytics.model.Readmissions;
import com.nicuanalytics.model.RevenueCodeFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class RollupMerger {

    private static final RevenueCodeFeature NO_REVENUE_CODE = new RevenueCodeFeature(null, false);

    private final RollupSettings settings;

    public List<NicuRollupRecord> mergeNicu(List<NicuRecord> nicuRecords, CodeFeatures codes, CostFeatures costs,
                                            Map<EpisodeKey, String> dischargeStatuses,
                                            Map<EpisodeKey, ProviderAttribution> providers) {
        List<NicuRollupRecord> merged = new ArrayList<>(nicuRecords.size());
        for (NicuRecord record : nicuRecords) {
            EpisodeKey key = record.getKey();
            ProfessionalFees fees = costs.getProfessionalFees().getOrDefault(key, ProfessionalFees.NONE);
            Readmissions readmissions = costs.getReadmissions().getOrDefault(key, Readmissions.NONE);
            RevenueCodeFeature revenue = codes.getRevenueCodes().getOrDefault(key, NO_REVENUE_CODE);
            ProviderAttribution provider = providers.get(key);
            BigDecimal totalCost = record.getTotalNicuCost() != null ? record.getTotalNicuCost() : BigDecimal.ZERO;

            merged.add(NicuRollupRecord.builder()
                .newborn(record.getNewborn())
                .totalNicuCost(totalCost)
                .professionalFee(fees.getTotal())
                .manageableProfessionalFee(fees.getManageable())
                .manageableServiceDays(fees.getManageableServiceDays())
                .criticalCareProfessionalFee(fees.getCriticalCare())
                .criticalCareDays(fees.getCriticalCareDays())
                .roomAndBoardCost(costs.getRoomAndBoard().getOrDefault(key, BigDecimal.ZERO))
                .facilityCost(totalCost.subtract(fees.getTotal()))
                .readmissions(readmissions.getCount())
                .readmissionPaidAmount(readmissions.getPaidAmount())
                .readmissionLengthOfStay(readmissions.getLengthOfStay())
                .nas(costs.getNas().contains(key))
                .gestationalAgeCategory(costs.getGestationalAge().get(key))
                .birthweightCategory(costs.getBirthweight().get(key))
                .finalRevenueCode(revenue.getFinalRevenueCode())
                .revenueLeveling(revenue.isLeveling())
                .finalDrgCode(codes.getDrgCodes().get(key))
                .dischargeStatus(dischargeStatuses.get(key))
                .providerId(provider != null ? provider.getProviderId() : null)
                .providerTin(provider != null ? provider.getProviderTin() : null)
                .providerName(provider != null ? provider.getProviderName() : null)
                .providerState(provider != null ? provider.getProviderState() : null)
                .lowPaidNicu(isLowPaid(totalCost, record.getLengthOfStay()))
                .inappropriateNicu(isInappropriate(record.getNewborn().getContract(), record.getLengthOfStay(),
                    revenue.getFinalRevenueCode()))
                .build());
        }
        return List.copyOf(merged);
    }

    public List<NewbornRollupRecord> mergeExport(List<NewbornRecord> newborns, List<NicuRollupRecord> nicuRows) {
        Map<NewbornRecord, NicuRollupRecord> nicuByNewborn = new HashMap<>();
        nicuRows.forEach(row -> nicuByNewborn.put(row.getNewborn(), row));

        List<NewbornRollupRecord> records = new ArrayList<>(newborns.size());
        for (NewbornRecord newborn : newborns) {
            records.add(NewbornRollupRecord.builder()
                .patientId(newborn.getPatientId())
                .birthDate(newborn.getBirthDate())
                .deliveryDate(newborn.getDeliveryDate())
                .businessLine(newborn.getBusinessLine())
                .productCode(newborn.getProductCode())
                .studyYear(newborn.getStudyYear())
                .admitDate(newborn.getAdmitDate())
                .dischargeDate(newborn.getDischargeDate())
                .lengthOfStay(newborn.getLengthOfStay())
                .paidAmount(newborn.getPaidAmount())
                .costPerDay(costPerDay(newborn.getPaidAmount(), newborn.getLengthOfStay()))
                .babyType(newborn.getBabyType())
                .birthType(newborn.getBirthType())
                .contract(newborn.getContract())
                .nicu(nicuByNewborn.get(newborn))
                .build());
        }
        return List.copyOf(records);
    }

    boolean isLowPaid(BigDecimal totalCost, int lengthOfStay) {
        if (lengthOfStay <= 0) {
            return false;
        }
        return totalCost.compareTo(settings.getLowPaidNicuThreshold().multiply(BigDecimal.valueOf(lengthOfStay))) < 0;
    }

    boolean isInappropriate(ContractType contract, int lengthOfStay, String finalRevenueCode) {
        return contract == ContractType.DRG
            && lengthOfStay <= settings.getInappropriateNicuMaxLos()
            && finalRevenueCode != null
            && settings.getInappropriateNicuRevenueCodes().contains(finalRevenueCode);
    }

    static BigDecimal costPerDay(BigDecimal paid, int lengthOfStay) {
        if (paid == null || lengthOfStay <= 0) {
            return null;
        }
        return paid.divide(BigDecimal.valueOf(lengthOfStay), 2, RoundingMode.HALF_UP);
    }
}
