package com.delta.jobfeed.sync.remote;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.http.AtsHttpClient;
import com.delta.jobfeed.sync.model.RemoteSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BullhornAuthenticatorTest {
    private MockWebServer server;
    private FeedSyncProperties properties;
    private BullhornAuthenticator authenticator;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new FeedSyncProperties();
        properties.setRequestTimeoutSeconds(5);
        FeedSyncProperties.Remote remote = properties.getRemote();
        remote.setAuthorizeUrl(server.url("/oauth/authorize").toString());
        remote.setTokenUrl(server.url("/oauth/token").toString());
        remote.setRestLoginUrl(server.url("/rest-services/login").toString());
        remote.setClientId("client");
        remote.setClientSecret("secret");
        remote.setUsername("api.user");
        remote.setPassword("p@ssword");
        authenticator = new BullhornAuthenticator(new AtsHttpClient(properties), new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void completesThreeStepExchange() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "https://example.com/cb?code=abc%3D123&client_id=client"));
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"access-1\",\"expires_in\":600}"));
        server.enqueue(new MockResponse().setBody("{\"BhRestToken\":\"rest-1\",\"restUrl\":\"https://rest9.example.com/rest-services/abc/\"}"));

        RemoteSession session = authenticator.authenticate();

        assertThat(session.restToken()).isEqualTo("rest-1");
        assertThat(session.endpoint("search/JobOrder")).isEqualTo("https://rest9.example.com/rest-services/abc/search/JobOrder");

        RecordedRequest authorize = server.takeRequest();
        assertThat(authorize.getMethod()).isEqualTo("GET");
        assertThat(authorize.getRequestUrl().queryParameter("password")).isEqualTo("p@ssword");
        assertThat(authorize.getRequestUrl().queryParameter("action")).isEqualTo("Login");

        RecordedRequest token = server.takeRequest();
        assertThat(token.getMethod()).isEqualTo("POST");
        assertThat(token.getBody().readUtf8()).contains("grant_type=authorization_code").contains("code=abc%3D123");

        RecordedRequest login = server.takeRequest();
        assertThat(login.getRequestUrl().queryParameter("access_token")).isEqualTo("access-1");
        assertThat(login.getRequestUrl().queryParameter("version")).isEqualTo("2.0");
    }

    @Test
    void missingAuthorizationCodeFails() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>login page</html>"));

        assertThatThrownBy(() -> authenticator.authenticate())
            .isInstanceOf(RemoteAuthException.class)
            .hasMessageContaining("Authorization step failed");
    }

    @Test
    void rejectedTokenExchangeFails() {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/cb?code=abc"));
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"invalid_grant\"}"));

        assertThatThrownBy(() -> authenticator.authenticate())
            .isInstanceOf(RemoteAuthException.class)
            .hasMessageContaining("Token step failed: http_400");
    }

    @Test
    void missingCredentialsFailWithoutCallingRemote() {
        properties.getRemote().setPassword(" ");

        assertThatThrownBy(() -> authenticator.authenticate())
            .isInstanceOf(RemoteAuthException.class)
            .hasMessageContaining("not configured");
        assertThat(server.getRequestCount()).isZero();
    }
}
