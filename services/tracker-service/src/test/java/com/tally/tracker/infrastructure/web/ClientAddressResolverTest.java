package com.tally.tracker.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockHttpServletRequest;

/** Unit tests for {@link ClientAddressResolver}. */
@DisplayName("ClientAddressResolver")
class ClientAddressResolverTest {

    private final ClientAddressResolver resolver = new ClientAddressResolver();

    @Nested
    @DisplayName("proxy headers")
    class ProxyHeaders {

        @Test
        @DisplayName("takes the first public address from x-forwarded-for")
        void firstPublicFromForwardedFor() {
            var request = new MockHttpServletRequest();
            request.addHeader("X-Forwarded-For", "10.0.0.4, 203.0.113.7, 198.51.100.2");

            assertThat(resolver.resolve(request)).isEqualTo("203.0.113.7");
        }

        @Test
        @DisplayName("falls through to the next header when one holds only private addresses")
        void skipsAllPrivateHeader() {
            var request = new MockHttpServletRequest();
            request.addHeader("X-Forwarded-For", "192.168.1.10, 127.0.0.1");
            request.addHeader("X-Real-IP", "198.51.100.23");

            assertThat(resolver.resolve(request)).isEqualTo("198.51.100.23");
        }

        @Test
        @DisplayName("respects header preference order")
        void headerOrder() {
            var request = new MockHttpServletRequest();
            request.addHeader("CF-Connecting-IP", "198.51.100.1");
            request.addHeader("X-Real-IP", "203.0.113.50");

            assertThat(resolver.resolve(request)).isEqualTo("203.0.113.50");
        }

        @Test
        @DisplayName("trims whitespace around addresses")
        void trims() {
            var request = new MockHttpServletRequest();
            request.addHeader("X-Client-IP", "   203.0.113.8  ");

            assertThat(resolver.resolve(request)).isEqualTo("203.0.113.8");
        }
    }

    @Nested
    @DisplayName("fallbacks")
    class Fallbacks {

        @Test
        @DisplayName("uses the socket address when no header helps")
        void remoteAddress() {
            var request = new MockHttpServletRequest();
            request.setRemoteAddr("127.0.0.1");
            request.addHeader("X-Forwarded-For", "10.1.1.1");

            assertThat(resolver.resolve(request)).isEqualTo("127.0.0.1");
        }

        @Test
        @DisplayName("returns 'unknown' when there is no address at all")
        void unknown() {
            var request = new MockHttpServletRequest();
            request.setRemoteAddr(null);

            assertThat(resolver.resolve(request)).isEqualTo("unknown");
        }
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "127.0.0.1", "10.2.3.4", "192.168.0.1", "172.31.0.9", "172.200.1.1",
                "169.254.10.10", "localhost", "::1", "0.0.0.0"
            })
    @DisplayName("treats loopback, private and link-local addresses as private")
    void privateAddresses(String address) {
        assertThat(ClientAddressResolver.isPrivate(address)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"8.8.8.8", "203.0.113.7", "2001:db8::1"})
    @DisplayName("treats other addresses as public")
    void publicAddresses(String address) {
        assertThat(ClientAddressResolver.isPrivate(address)).isFalse();
    }
}
