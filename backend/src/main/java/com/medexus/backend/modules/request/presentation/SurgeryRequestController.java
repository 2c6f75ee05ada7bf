package com.medexus.backend.modules.request.presentation;

import java.util.List;
import java.util.UUID;

import com.medexus.backend.global.security.JwtAuthenticationPrincipal;
import com.medexus.backend.global.web.MessageResponse;
import com.medexus.backend.modules.request.application.SurgeryRequestService;
import com.medexus.backend.modules.request.presentation.dto.SurgeryRequestPayload;
import com.medexus.backend.modules.request.presentation.dto.SurgeryRequestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/requests")
public class SurgeryRequestController {

    private final SurgeryRequestService surgeryRequestService;

    public SurgeryRequestController(SurgeryRequestService surgeryRequestService) {
        this.surgeryRequestService = surgeryRequestService;
    }

    @PostMapping
    public ResponseEntity<SurgeryRequestResponse> createRequest(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SurgeryRequestPayload payload
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(surgeryRequestService.createRequest(principal, payload));
    }

    @Operation(
            summary = "List surgery requests",
            description = """
                    Hospitals receive their own requests with `interested_doctors`. \
                    Doctors receive every request with the hospital's current institution name.
                    """
    )
    @GetMapping
    public ResponseEntity<List<SurgeryRequestResponse>> listRequests(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(surgeryRequestService.listRequests(principal));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<SurgeryRequestResponse> getRequest(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("requestId") UUID requestId
    ) {
        return ResponseEntity.ok(surgeryRequestService.getRequest(principal, requestId));
    }

    @PutMapping("/{requestId}")
    public ResponseEntity<SurgeryRequestResponse> updateRequest(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody SurgeryRequestPayload payload
    ) {
        return ResponseEntity.ok(surgeryRequestService.updateRequest(principal, requestId, payload));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Request and its interests removed"),
            @ApiResponse(responseCode = "403", description = "Caller is not the owning hospital"),
            @ApiResponse(responseCode = "404", description = "Request does not exist")
    })
    @DeleteMapping("/{requestId}")
    public ResponseEntity<MessageResponse> deleteRequest(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("requestId") UUID requestId
    ) {
        surgeryRequestService.deleteRequest(principal, requestId);
        return ResponseEntity.ok(new MessageResponse("Request deleted successfully"));
    }
}
