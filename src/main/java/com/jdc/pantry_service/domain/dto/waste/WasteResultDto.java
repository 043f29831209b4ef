package com.jdc.pantry_service.domain.dto.waste;

public record WasteResultDto(int daysOwned) { }
