package geosite.adapter.out.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.headRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Duration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import geosite.config.GeositeConfig;
import geosite.core.error.UpstreamTransportException;

@DisplayName("VertxArchiveTransport")
@ExtendWith(MockitoExtension.class)
class VertxArchiveTransportTest {

    private static final String ARCHIVE_PATH = "/archive/master.zip";

    @Mock
    private GeositeConfig.Source config;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VertxArchiveTransport transport;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.archiveUrl()).thenReturn(wireMockServer.baseUrl() + ARCHIVE_PATH);
        lenient().when(config.userAgent()).thenReturn("geosite-test");
        lenient().when(config.fingerprintTimeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.downloadTimeout()).thenReturn(Duration.ofSeconds(5));

        transport = new VertxArchiveTransport(vertx, config);
        transport.init();
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    @Nested
    @DisplayName("fetchFingerprint")
    class FetchFingerprint {

        @Test
        @DisplayName("should return the ETag of a HEAD request")
        void shouldReturnEtag() {
            wireMockServer.stubFor(head(urlEqualTo(ARCHIVE_PATH))
                    .willReturn(aResponse().withStatus(200).withHeader("ETag", "\"abc123\"")));

            var token = transport.fetchFingerprint().await().indefinitely();

            assertEquals("abc123", token);
            wireMockServer.verify(headRequestedFor(urlEqualTo(ARCHIVE_PATH))
                    .withHeader("User-Agent", equalTo("geosite-test")));
        }

        @Test
        @DisplayName("should return an empty token when no ETag is advertised")
        void shouldReturnEmptyWithoutEtag() {
            wireMockServer.stubFor(head(urlEqualTo(ARCHIVE_PATH)).willReturn(aResponse().withStatus(200)));

            assertEquals("", transport.fetchFingerprint().await().indefinitely());
        }

        @Test
        @DisplayName("should fail on a non-200 status")
        void shouldFailOnErrorStatus() {
            wireMockServer.stubFor(head(urlEqualTo(ARCHIVE_PATH)).willReturn(aResponse().withStatus(503)));

            var error = assertThrows(UpstreamTransportException.class,
                    () -> transport.fetchFingerprint().await().indefinitely());
            assertTrue(error.getMessage().contains("503"));
        }

        @Test
        @DisplayName("should fail when the upstream is unreachable")
        void shouldFailWhenUnreachable() {
            wireMockServer.stop();

            assertThrows(UpstreamTransportException.class,
                    () -> transport.fetchFingerprint().await().indefinitely());
        }
    }

    @Nested
    @DisplayName("download")
    class Download {

        @Test
        @DisplayName("should return the response body bytes")
        void shouldReturnBody() {
            var payload = new byte[] {0x50, 0x4b, 0x03, 0x04, 0x7f};
            wireMockServer.stubFor(get(urlEqualTo(ARCHIVE_PATH))
                    .willReturn(aResponse().withStatus(200).withBody(payload)));

            assertArrayEquals(payload, transport.download().await().indefinitely());
            wireMockServer.verify(getRequestedFor(urlEqualTo(ARCHIVE_PATH))
                    .withHeader("User-Agent", equalTo("geosite-test")));
        }

        @Test
        @DisplayName("should fail on a non-200 status")
        void shouldFailOnErrorStatus() {
            wireMockServer.stubFor(get(urlEqualTo(ARCHIVE_PATH)).willReturn(aResponse().withStatus(404)));

            assertThrows(UpstreamTransportException.class, () -> transport.download().await().indefinitely());
        }
    }

    @ParameterizedTest(name = "[{0}] -> [{1}]")
    @CsvSource(delimiter = '|', value = {
        "\"abc\"      | abc",
        "W/\"abc\"    | abc",
        "abc          | abc",
        "'  \"x-1\" ' | x-1"
    })
    @DisplayName("should normalize ETag values")
    void shouldNormalizeEtag(String raw, String expected) {
        assertEquals(expected, VertxArchiveTransport.normalizeEtag(raw));
    }

    @Test
    @DisplayName("should normalize a missing ETag to an empty token")
    void shouldNormalizeNullEtag() {
        assertEquals("", VertxArchiveTransport.normalizeEtag(null));
    }
}
