package com.subradar.api.dto;

public record CancellationLinkResponse(String merchant, String url, String source) {
}
