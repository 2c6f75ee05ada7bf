package com.medexus.backend.global.web;

public record MessageResponse(String message) {
}
