package com.homeplanner.mortgage.controller;

import com.homeplanner.mortgage.controller.dto.CompareRequestDto;
import com.homeplanner.mortgage.controller.dto.LoanRequestDto;
import com.homeplanner.mortgage.controller.dto.PaymentPlanRequestDto;
import com.homeplanner.mortgage.controller.dto.ProjectionResponseDto;
import com.homeplanner.mortgage.controller.dto.SavingsResponseDto;
import com.homeplanner.mortgage.controller.dto.ScheduleRequestDto;
import com.homeplanner.mortgage.controller.dto.ScheduleResponseDto;
import com.homeplanner.mortgage.model.AmortizationSchedule;
import com.homeplanner.mortgage.model.LoanTerms;
import com.homeplanner.mortgage.model.MortgageProjection;
import com.homeplanner.mortgage.model.PaymentPlan;
import com.homeplanner.mortgage.model.SavingsSummary;
import com.homeplanner.mortgage.service.MortgageProjectionService;
import jakarta.validation.Valid;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mortgage")
public class MortgageController {

    private final MortgageProjectionService projectionService;

    public MortgageController(MortgageProjectionService projectionService) {
        this.projectionService = projectionService;
    }

    @PostMapping("/schedule")
    public ResponseEntity<ScheduleResponseDto> schedule(@Valid @RequestBody ScheduleRequestDto request) {
        AmortizationSchedule schedule = projectionService.schedule(toLoan(request.loan()), toPlan(request.plan()));
        return ResponseEntity.ok(mapSchedule(schedule));
    }

    @PostMapping("/compare")
    public ResponseEntity<SavingsResponseDto> compare(@Valid @RequestBody CompareRequestDto request) {
        SavingsSummary savings = projectionService.compare(
                toLoan(request.loan()),
                toPlan(request.baselinePlan()),
                toPlan(request.scenarioPlan())
        );
        return ResponseEntity.ok(mapSavings(savings));
    }

    @PostMapping("/projection")
    public ResponseEntity<ProjectionResponseDto> projection(@Valid @RequestBody ScheduleRequestDto request) {
        MortgageProjection projection = projectionService.project(toLoan(request.loan()), toPlan(request.plan()));
        return ResponseEntity.ok(new ProjectionResponseDto(
                mapSchedule(projection.schedule()),
                mapSavings(projection.savings()),
                new ProjectionResponseDto.HousingCost(
                        projection.housingCost().principalAndInterest(),
                        projection.housingCost().withPmi(),
                        projection.housingCost().withoutPmi()
                ),
                projection.pmiRemovalDate(),
                projection.pmiRemovalEvaluable(),
                projection.notes(),
                projection.traceId()
        ));
    }

    private static LoanTerms toLoan(LoanRequestDto dto) {
        return LoanTerms.builder()
                .principal(dto.principal())
                .annualRatePercent(dto.annualRatePercent())
                .termMonths(dto.termMonths())
                .startMonth(dto.startMonth())
                .homeValue(dto.homeValue())
                .monthlyTax(dto.monthlyTax())
                .monthlyInsurance(dto.monthlyInsurance())
                .monthlyHoa(dto.monthlyHoa())
                .monthlyPmi(dto.monthlyPmi())
                .monthlyPaymentOverride(dto.monthlyPaymentOverride())
                .build();
    }

    private static PaymentPlan toPlan(PaymentPlanRequestDto dto) {
        if (dto == null) {
            return PaymentPlan.none();
        }
        return new PaymentPlan(
                dto.extraMonthly(),
                Optional.ofNullable(dto.effectiveFromMonth()).orElse(1),
                Optional.ofNullable(dto.oneTimeExtra())
                        .map(extra -> new PaymentPlan.OneTimeExtra(extra.monthIndex(), extra.amount()))
        );
    }

    private static ScheduleResponseDto mapSchedule(AmortizationSchedule schedule) {
        return new ScheduleResponseDto(
                schedule.monthlyPayment(),
                schedule.totalMonths(),
                schedule.totalInterest(),
                schedule.totalPaid(),
                schedule.totalEscrow(),
                schedule.payoffDate().orElse(null),
                schedule.pmiRemovalDate().orElse(null),
                schedule.entries().stream()
                        .map(entry -> new ScheduleResponseDto.Entry(
                                entry.monthIndex(),
                                entry.calendarDate(),
                                entry.beginningBalance(),
                                entry.scheduledPrincipal(),
                                entry.scheduledInterest(),
                                entry.extraPrincipal(),
                                entry.endingBalance(),
                                entry.pmiActive(),
                                entry.escrowAddOns(),
                                entry.totalPayment(),
                                entry.cumulativeInterest()
                        ))
                        .toList()
        );
    }

    private static SavingsResponseDto mapSavings(SavingsSummary savings) {
        return new SavingsResponseDto(
                savings.monthsShaved(),
                savings.interestSaved(),
                savings.baselineMonths(),
                savings.scenarioMonths(),
                savings.baselineInterest(),
                savings.scenarioInterest(),
                savings.baselinePayoffDate(),
                savings.scenarioPayoffDate()
        );
    }
}
