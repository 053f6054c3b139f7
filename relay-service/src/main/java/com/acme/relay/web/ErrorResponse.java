package com.acme.relay.web;

/** Error body for rejected or failed directives. */
public record ErrorResponse(String message, int statusCode) {}
