package com.example.cameratrap.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Storage events accepted for asynchronous processing")
public record IngestResponse(
        @Schema(description = "Storage keys handed to pipeline workers") List<String> acceptedKeys) {
}
