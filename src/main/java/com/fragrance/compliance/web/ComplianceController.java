package com.fragrance.compliance.web;

import com.fragrance.compliance.domain.ComplianceResult;
import com.fragrance.compliance.service.ComplianceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/compliance")
@RequiredArgsConstructor
public class ComplianceController {

    private final ComplianceService complianceService;

    @PostMapping
    public ResponseEntity<ComplianceResult> check(@RequestBody ComplianceRequest request) {
        ComplianceResult result = complianceService.checkRequest(
                request.getFormula(),
                request.getFinishedDosage()
        );
        return ResponseEntity.ok(result);
    }
}
