package com.wabridge.apiwhatsapp.whatsapp;

import java.time.Instant;

public record QrCode(String qr, Instant expiresAt) {}
