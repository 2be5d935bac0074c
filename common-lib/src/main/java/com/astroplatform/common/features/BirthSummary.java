package com.astroplatform.common.features;

import java.time.LocalDate;

public record BirthSummary(LocalDate date, String time, String location) {}
