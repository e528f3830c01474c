package com.phillippitts.classmate.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/** Body of {@code POST /sessions}. */
record CreateSessionRequest(
        @NotBlank @Size(max = 120) String name,
        @Size(max = 2000) String description,
        List<String> materials
) {}
