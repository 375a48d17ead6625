package com.wabridge.apiwhatsapp.forward;

/** Conversions between WhatsApp JIDs ({@code 85291234567@s.whatsapp.net}) and E.164 numbers. */
public final class PhoneNumbers {

  public static final String USER_SERVER = "@s.whatsapp.net";

  private PhoneNumbers() {}

  public static String toE164(String jid) {
    String user = jid == null ? "" : jid;
    int at = user.indexOf('@');
    if (at >= 0) {
      user = user.substring(0, at);
    }
    return user.startsWith("+") ? user : "+" + user;
  }

  /** Keeps only the digits of {@code phone} and addresses them to an individual chat. */
  public static String toJid(String phone) {
    String digits = phone == null ? "" : phone.replaceAll("\\D", "");
    return digits + USER_SERVER;
  }
}
