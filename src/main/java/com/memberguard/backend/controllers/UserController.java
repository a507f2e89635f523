package com.memberguard.backend.controllers;

import com.memberguard.backend.dto.AccessRequestDto;
import com.memberguard.backend.dto.AccessRequestSubmission;
import com.memberguard.backend.dto.ContactRequest;
import com.memberguard.backend.dto.UserDto;
import com.memberguard.backend.models.AccessRequest;
import com.memberguard.backend.models.Offer;
import com.memberguard.backend.services.AccessRequestService;
import com.memberguard.backend.services.OfferService;
import com.memberguard.backend.services.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Endpoints the chat front end calls on behalf of users
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final UserService userService;
    private final AccessRequestService accessRequestService;
    private final OfferService offerService;

    @PostMapping("/contacts")
    public ResponseEntity<UserDto> registerContact(@Valid @RequestBody ContactRequest body) {
        UserService.ContactResult result = userService.registerContact(
                body.getTelegramId(), body.getName(), body.getUsername(), body.getReferralCode());
        return ResponseEntity
                .status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(UserDto.from(result.user()));
    }

    @GetMapping("/{telegramId}")
    public ResponseEntity<UserDto> getUser(@PathVariable Long telegramId) {
        return ResponseEntity.ok(UserDto.from(userService.getByTelegramId(telegramId)));
    }

    @PostMapping("/{telegramId}/access-requests")
    public ResponseEntity<AccessRequestDto> requestAccess(@PathVariable Long telegramId,
                                                          @RequestBody(required = false) AccessRequestSubmission body) {
        Long planId = body != null ? body.getPlanId() : null;
        AccessRequest request = accessRequestService.submit(telegramId, planId);
        return ResponseEntity.ok(AccessRequestDto.from(request));
    }

    @GetMapping("/offers")
    public ResponseEntity<List<Map<String, Object>>> activeOffers() {
        List<Map<String, Object>> offers = offerService.activeOffers().stream()
                .map(UserController::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(offers);
    }

    private static Map<String, Object> toResponse(Offer offer) {
        Map<String, Object> response = new HashMap<>();
        response.put("id", offer.getId());
        response.put("title", offer.getTitle());
        response.put("description", offer.getDescription());
        response.put("discountPercent", offer.getDiscountPercent());
        response.put("validTill", offer.getValidTill());
        return response;
    }
}
