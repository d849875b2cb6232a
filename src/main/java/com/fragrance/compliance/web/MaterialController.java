package com.fragrance.compliance.web;

import com.fragrance.compliance.domain.MaterialBreakdown;
import com.fragrance.compliance.domain.MaterialSummary;
import com.fragrance.compliance.service.MaterialLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/materials")
@RequiredArgsConstructor
public class MaterialController {

    private final MaterialLookupService lookupService;

    @GetMapping
    public ResponseEntity<List<MaterialSummary>> search(@RequestParam(name = "q", required = false) String query,
                                                        @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(lookupService.search(query, limit));
    }

    @GetMapping("/{key}")
    public ResponseEntity<MaterialBreakdown> breakdown(@PathVariable String key) {
        return ResponseEntity.ok(lookupService.breakdown(key));
    }
}
