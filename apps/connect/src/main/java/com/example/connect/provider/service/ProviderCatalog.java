package com.example.connect.provider.service;

import com.example.connect.provider.model.ProviderEndpoints;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Providers this service knows how to talk to. Adding one is a code change;
 * enabling one is a configuration change (client id and secret).
 */
public final class ProviderCatalog {

    public static final String NOTION = "notion";
    public static final String GMAIL = "gmail";
    public static final String GITHUB = "github";

    private static final Map<String, ProviderEndpoints> BUILT_IN;

    static {
        Map<String, ProviderEndpoints> catalog = new LinkedHashMap<>();
        // Notion rejects the scope parameter
        catalog.put(NOTION, new ProviderEndpoints(
                NOTION,
                "Notion",
                "https://api.notion.com/v1/oauth/authorize",
                "https://api.notion.com/v1/oauth/token",
                "",
                "code"));
        catalog.put(GMAIL, new ProviderEndpoints(
                GMAIL,
                "Gmail",
                "https://accounts.google.com/o/oauth2/v2/auth",
                "https://oauth2.googleapis.com/token",
                "https://www.googleapis.com/auth/gmail.send",
                "code"));
        catalog.put(GITHUB, new ProviderEndpoints(
                GITHUB,
                "GitHub",
                "https://github.com/login/oauth/authorize",
                "https://github.com/login/oauth/access_token",
                "repo user",
                "code"));
        BUILT_IN = Collections.unmodifiableMap(catalog);
    }

    private ProviderCatalog() {}

    public static Map<String, ProviderEndpoints> builtIn() {
        return BUILT_IN;
    }
}
