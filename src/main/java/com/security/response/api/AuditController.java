package com.security.response.api;

import com.security.response.core.ProposalService;
import com.security.response.domain.AuditEntry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Append-only trail of proposal transitions and config changes")
public class AuditController {

    private final ProposalService proposalService;

    @GetMapping
    @Operation(summary = "List audit entries", description = "In append order; filter by proposalId")
    public ResponseEntity<List<AuditEntry>> list(@RequestParam(required = false) String proposalId) {
        return ResponseEntity.ok(proposalService.auditTrail(proposalId));
    }
}
