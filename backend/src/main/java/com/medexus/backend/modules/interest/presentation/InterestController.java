package com.medexus.backend.modules.interest.presentation;

import java.util.List;
import java.util.UUID;

import com.medexus.backend.global.security.JwtAuthenticationPrincipal;
import com.medexus.backend.global.web.MessageResponse;
import com.medexus.backend.modules.interest.application.InterestService;
import com.medexus.backend.modules.interest.presentation.dto.ExpressInterestRequest;
import com.medexus.backend.modules.interest.presentation.dto.InterestResponse;
import com.medexus.backend.modules.interest.presentation.dto.MyInterestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/interests")
public class InterestController {

    private final InterestService interestService;

    public InterestController(InterestService interestService) {
        this.interestService = interestService;
    }

    @Operation(summary = "Express interest", description = "A doctor signals willingness to take a surgery request.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Interest recorded"),
            @ApiResponse(responseCode = "403", description = "Caller is not a doctor"),
            @ApiResponse(responseCode = "404", description = "Request does not exist"),
            @ApiResponse(responseCode = "409", description = "Interest already expressed")
    })
    @PostMapping
    public ResponseEntity<InterestResponse> expressInterest(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ExpressInterestRequest request
    ) {
        return ResponseEntity.ok(interestService.expressInterest(principal, request.requestId()));
    }

    @DeleteMapping("/{requestId}")
    public ResponseEntity<MessageResponse> withdrawInterest(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("requestId") UUID requestId
    ) {
        interestService.withdrawInterest(principal, requestId);
        return ResponseEntity.ok(new MessageResponse("Interest withdrawn successfully"));
    }

    @GetMapping("/me")
    public ResponseEntity<List<MyInterestResponse>> myInterests(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(interestService.listMyInterests(principal));
    }
}
