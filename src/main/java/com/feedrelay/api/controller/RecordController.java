package com.feedrelay.api.controller;

import com.feedrelay.api.dto.request.DataRecordRequest;
import com.feedrelay.api.dto.response.DataRecordResponse;
import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.mapper.DataRecordMapper;
import com.feedrelay.record.DataRecordService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Producer endpoint: stores a record and starts its delivery.
 */
@RestController
@RequestMapping("/api/records")
public class RecordController {

    private final DataRecordService dataRecordService;
    private final DataRecordMapper dataRecordMapper;

    public RecordController(DataRecordService dataRecordService, DataRecordMapper dataRecordMapper) {
        this.dataRecordService = dataRecordService;
        this.dataRecordMapper = dataRecordMapper;
    }

    @PostMapping
    public ResponseEntity<DataRecordResponse> create(@Valid @RequestBody DataRecordRequest request) {
        DataRecord stored = dataRecordService.ingest(dataRecordMapper.toDomain(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(dataRecordMapper.toResponse(stored));
    }
}
