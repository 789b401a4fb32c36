package com.tickdata.api.controller;

import com.tickdata.api.dto.response.MismatchReportResponse;
import com.tickdata.domain.model.MismatchReport;
import com.tickdata.mapper.MismatchReportMapper;
import com.tickdata.reconciliation.BhavcopyCheckService;
import java.time.LocalDate;
import org.mapstruct.factory.Mappers;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint running the bhavcopy data-quality checks for a trade date.
 *
 * <p>Endpoint:
 * <ul>
 *   <li>GET /api/quality-checks?tdate=YYYY-MM-DD</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/quality-checks")
public class QualityCheckController {

    private final BhavcopyCheckService bhavcopyCheckService;
    private final MismatchReportMapper mismatchReportMapper = Mappers.getMapper(MismatchReportMapper.class);

    public QualityCheckController(BhavcopyCheckService bhavcopyCheckService) {
        this.bhavcopyCheckService = bhavcopyCheckService;
    }

    @GetMapping
    public ResponseEntity<MismatchReportResponse> runChecks(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate tdate) {
        MismatchReport report = bhavcopyCheckService.runChecks(tdate);
        return ResponseEntity.ok(mismatchReportMapper.toResponse(tdate, report));
    }
}
