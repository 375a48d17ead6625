package com.wabridge.apiwhatsapp.whatsapp;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionStatus(boolean connected, String phoneNumber) {}
