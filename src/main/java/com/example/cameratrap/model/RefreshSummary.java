package com.example.cameratrap.model;

import java.time.Instant;

public record RefreshSummary(int locationRows, int speciesRows, Instant refreshedAt) {
}
