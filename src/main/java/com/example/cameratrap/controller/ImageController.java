package com.example.cameratrap.controller;

import com.example.cameratrap.model.ImageStatusResponse;
import com.example.cameratrap.service.query.ImageQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/images")
@Tag(name = "Images", description = "Processing status and detections per image")
public class ImageController {

    private final ImageQueryService queryService;

    public ImageController(ImageQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    @Operation(summary = "Look up an image by storage key",
            description = "Returns the latest persisted status, the failure message for failed images and the detections ordered by confidence.")
    public ResponseEntity<ImageStatusResponse> byKey(@RequestParam("key") String key) {
        if (!StringUtils.hasText(key)) {
            throw new ResponseStatusException(BAD_REQUEST, "Storage key is required");
        }
        return queryService.findByStorageKey(key)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No image registered for key " + key));
    }
}
