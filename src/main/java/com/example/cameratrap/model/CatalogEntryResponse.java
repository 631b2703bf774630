package com.example.cameratrap.model;

public record CatalogEntryResponse(Long id, String naturalKey) {
}
