package org.vellaric.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import org.vellaric.config.NetworkProperties;
import org.vellaric.exception.DnsException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CloudflareDnsProviderTest {

    private static final String API = "https://api.cloudflare.com/client/v4";

    private MockRestServiceServer server;

    private CloudflareDnsProvider provider;

    @BeforeEach
    void setUp() {
        NetworkProperties properties = new NetworkProperties();
        properties.getDns().getCloudflare().setApiToken("cf-token");
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new CloudflareDnsProvider(properties, restTemplate, new ObjectMapper());
    }

    private void expectZoneLookup() {
        server.expect(requestTo(API + "/zones?name=example.com"))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header("Authorization", "Bearer cf-token"))
            .andRespond(withSuccess("{\"success\":true,\"result\":[{\"id\":\"zone-1\"}]}", MediaType.APPLICATION_JSON));
    }

    @Test
    void createsMissingRecord() {
        expectZoneLookup();
        server.expect(requestTo(API + "/zones/zone-1/dns_records?name=api.example.com"))
            .andRespond(withSuccess("{\"success\":true,\"result\":[]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/zones/zone-1/dns_records"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.type").value("A"))
            .andExpect(jsonPath("$.content").value("203.0.113.10"))
            .andExpect(jsonPath("$.proxied").value(false))
            .andRespond(withSuccess("{\"success\":true,\"result\":{\"id\":\"rec-1\"}}", MediaType.APPLICATION_JSON));

        provider.upsertARecord("api.example.com", "203.0.113.10");

        server.verify();
    }

    @Test
    void updatesExistingRecord() {
        expectZoneLookup();
        server.expect(requestTo(API + "/zones/zone-1/dns_records?name=api.example.com"))
            .andRespond(withSuccess("{\"success\":true,\"result\":[{\"id\":\"rec-1\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/zones/zone-1/dns_records/rec-1"))
            .andExpect(method(HttpMethod.PUT))
            .andRespond(withSuccess("{\"success\":true,\"result\":{\"id\":\"rec-1\"}}", MediaType.APPLICATION_JSON));

        provider.upsertARecord("api.example.com", "203.0.113.10");

        server.verify();
    }

    @Test
    void apiErrorsBecomeDnsException() {
        server.expect(requestTo(API + "/zones?name=example.com"))
            .andRespond(withSuccess("{\"success\":false,\"errors\":[{\"message\":\"Invalid API Token\"}]}",
                MediaType.APPLICATION_JSON));

        DnsException e = assertThrows(DnsException.class, () -> provider.upsertARecord("api.example.com", "203.0.113.10"));
        assertEquals("Invalid API Token", e.getMessage());
    }

    @Test
    void rootDomainUsesTheLastTwoLabels() {
        assertEquals("example.com", CloudflareDnsProvider.rootDomain("api-dev.example.com"));
        assertEquals("example.com", CloudflareDnsProvider.rootDomain("example.com"));
    }
}
