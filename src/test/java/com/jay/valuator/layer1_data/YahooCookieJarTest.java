package com.jay.valuator.layer1_data;

import okhttp3.Cookie;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class YahooCookieJarTest {

    private static final HttpUrl FC = HttpUrl.get("https://fc.yahoo.com/");
    private static final HttpUrl QUERY = HttpUrl.get("https://query2.finance.yahoo.com/v10/finance/quoteSummary/MSFT");

    private static Cookie cookie(String name, String value, String domain) {
        return new Cookie.Builder().name(name).value(value).domain(domain).path("/").build();
    }

    @Test
    void refreshedCookieReplacesOldOneInsteadOfAppending() {
        YahooCookieJar jar = new YahooCookieJar();

        jar.saveFromResponse(FC, List.of(cookie("A3", "first", "yahoo.com")));
        jar.saveFromResponse(FC, List.of(cookie("A3", "second", "yahoo.com")));

        assertThat(jar.size()).isEqualTo(1);
        assertThat(jar.loadForRequest(QUERY)).extracting(Cookie::value).containsExactly("second");
    }

    @Test
    void sameNameOnAnotherDomainIsKeptSeparately() {
        YahooCookieJar jar = new YahooCookieJar();

        jar.saveFromResponse(FC, List.of(cookie("A3", "yahoo", "yahoo.com")));
        jar.saveFromResponse(HttpUrl.get("https://example.com/"), List.of(cookie("A3", "other", "example.com")));

        assertThat(jar.size()).isEqualTo(2);
    }

    @Test
    void requestOnlyGetsCookiesMatchingItsUrl() {
        YahooCookieJar jar = new YahooCookieJar();
        jar.saveFromResponse(FC, List.of(cookie("A3", "yahoo", "yahoo.com")));
        jar.saveFromResponse(HttpUrl.get("https://example.com/"), List.of(cookie("sid", "other", "example.com")));

        assertThat(jar.loadForRequest(QUERY)).extracting(Cookie::name).containsExactly("A3");
        assertThat(jar.loadForRequest(HttpUrl.get("https://example.com/x"))).extracting(Cookie::name)
            .containsExactly("sid");
    }
}
