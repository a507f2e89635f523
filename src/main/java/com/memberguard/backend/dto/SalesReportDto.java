package com.memberguard.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesReportDto {

    private LocalDate from;
    private LocalDate to;
    private List<PlanSalesDto> plans;

    public long getTotalSubscriptions() {
        return plans == null ? 0 : plans.stream().mapToLong(PlanSalesDto::getSubscriptions).sum();
    }

    public BigDecimal getTotalRevenue() {
        if (plans == null) {
            return BigDecimal.ZERO;
        }
        return plans.stream()
                .map(PlanSalesDto::getRevenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
