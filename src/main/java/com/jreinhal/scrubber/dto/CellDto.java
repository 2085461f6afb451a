package com.jreinhal.scrubber.dto;

public record CellDto(String coordinate, String text) {
}
