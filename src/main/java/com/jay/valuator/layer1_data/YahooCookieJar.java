package com.jay.valuator.layer1_data;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory cookie jar for the Yahoo session. A cookie replaces any stored one
 * with the same name, domain and path, so crumb refreshes do not pile up
 * duplicates. Requests only get the cookies that match their URL.
 */
class YahooCookieJar implements CookieJar {

    private final List<Cookie> cookieStore = new CopyOnWriteArrayList<>();

    @Override
    public synchronized void saveFromResponse(HttpUrl url, List<Cookie> cookies) {
        for (Cookie c : cookies) {
            cookieStore.removeIf(old -> old.name().equals(c.name())
                && old.domain().equals(c.domain())
                && old.path().equals(c.path()));
            cookieStore.add(c);
        }
    }

    @Override
    public List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        cookieStore.removeIf(c -> c.expiresAt() < now);
        List<Cookie> matched = new ArrayList<>();
        for (Cookie c : cookieStore) { if (c.matches(url)) matched.add(c); }
        return matched;
    }

    int size() {
        return cookieStore.size();
    }
}
