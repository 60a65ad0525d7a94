package personal.meet.scheduling.availability.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.meet.scheduling.availability.adapter.in.web.dto.AvailabilityRuleCreateRequest;
import personal.meet.scheduling.availability.adapter.in.web.dto.AvailabilityRuleResponse;
import personal.meet.scheduling.availability.adapter.in.web.dto.AvailabilityRuleUpdateRequest;
import personal.meet.scheduling.availability.adapter.in.web.dto.SlotAvailabilityResponse;
import personal.meet.scheduling.availability.application.port.in.GenerateSlotsUseCase;
import personal.meet.scheduling.availability.application.port.in.GetAvailabilityRulesUseCase;
import personal.meet.scheduling.availability.application.port.in.ManageAvailabilityRuleUseCase;
import personal.meet.scheduling.availability.domain.model.AvailabilityRule;
import personal.meet.scheduling.availability.domain.model.SlotAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability API Controller
 * 슬롯 조회 및 가용 시간 규칙 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/hosts/{hostId}")
@RequiredArgsConstructor
public class AvailabilityController {

    private final GenerateSlotsUseCase generateSlotsUseCase;
    private final GetAvailabilityRulesUseCase getAvailabilityRulesUseCase;
    private final ManageAvailabilityRuleUseCase manageAvailabilityRuleUseCase;

    /**
     * 예약 가능 슬롯 조회
     * GET /api/v1/hosts/{hostId}/slots?date=2026-03-02&duration=60
     */
    @GetMapping("/slots")
    public ResponseEntity<SlotAvailabilityResponse> getSlots(
            @PathVariable Long hostId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "60") int duration
    ) {
        log.info("Get slots: hostId={}, date={}, duration={}", hostId, date, duration);

        SlotAvailability availability = generateSlotsUseCase.generateSlots(hostId, date, duration);

        return ResponseEntity.ok(SlotAvailabilityResponse.from(availability));
    }

    /**
     * GET /api/v1/hosts/{hostId}/availability-rules
     */
    @GetMapping("/availability-rules")
    public ResponseEntity<List<AvailabilityRuleResponse>> listRules(@PathVariable Long hostId) {
        log.info("List availability rules: hostId={}", hostId);

        List<AvailabilityRuleResponse> response = getAvailabilityRulesUseCase.listRules(hostId).stream()
                .map(AvailabilityRuleResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/v1/hosts/{hostId}/availability-rules/{ruleId}
     */
    @GetMapping("/availability-rules/{ruleId}")
    public ResponseEntity<AvailabilityRuleResponse> getRule(
            @PathVariable Long hostId,
            @PathVariable Long ruleId
    ) {
        AvailabilityRule rule = getAvailabilityRulesUseCase.getRule(hostId, ruleId);
        return ResponseEntity.ok(AvailabilityRuleResponse.from(rule));
    }

    /**
     * POST /api/v1/hosts/{hostId}/availability-rules
     */
    @PostMapping("/availability-rules")
    public ResponseEntity<AvailabilityRuleResponse> createRule(
            @PathVariable Long hostId,
            @Valid @RequestBody AvailabilityRuleCreateRequest request
    ) {
        log.info("Create availability rule: hostId={}, dayOfWeek={}", hostId, request.dayOfWeek());

        AvailabilityRule rule = manageAvailabilityRuleUseCase.createRule(request.toCommand(hostId));

        return ResponseEntity.status(HttpStatus.CREATED).body(AvailabilityRuleResponse.from(rule));
    }

    /**
     * PATCH /api/v1/hosts/{hostId}/availability-rules/{ruleId}
     */
    @PatchMapping("/availability-rules/{ruleId}")
    public ResponseEntity<AvailabilityRuleResponse> updateRule(
            @PathVariable Long hostId,
            @PathVariable Long ruleId,
            @Valid @RequestBody AvailabilityRuleUpdateRequest request
    ) {
        log.info("Update availability rule: hostId={}, ruleId={}", hostId, ruleId);

        AvailabilityRule rule = manageAvailabilityRuleUseCase.updateRule(request.toCommand(hostId, ruleId));

        return ResponseEntity.ok(AvailabilityRuleResponse.from(rule));
    }

    /**
     * DELETE /api/v1/hosts/{hostId}/availability-rules/{ruleId}
     */
    @DeleteMapping("/availability-rules/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @PathVariable Long hostId,
            @PathVariable Long ruleId
    ) {
        log.info("Delete availability rule: hostId={}, ruleId={}", hostId, ruleId);

        manageAvailabilityRuleUseCase.deleteRule(hostId, ruleId);

        return ResponseEntity.noContent().build();
    }
}
