package com.cbcluster.orchestrator.controller;

public record CommandResponse(String resource, String command, boolean accepted) {
}
