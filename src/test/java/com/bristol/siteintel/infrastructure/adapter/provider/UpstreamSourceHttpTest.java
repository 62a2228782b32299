package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamSourceHttpTest {

    private static final String BLS_BODY = """
            {"status": "REQUEST_SUCCEEDED", "Results": {"series": [{"data": []}]}}
            """;

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private WireMockServer wireMockServer;
    private Retrofit retrofit;
    private UpstreamProperties properties;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().port(8089));
        wireMockServer.start();
        WireMock.configureFor("localhost", 8089);

        retrofit = new Retrofit.Builder()
                .baseUrl("http://localhost:8089/")
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .build();

        properties = new UpstreamProperties();
        for (var id : new String[]{"bls", "fbi", "bea", "noaa", "foursquare", "census", "hud"}) {
            var upstream = new UpstreamProperties.Upstream();
            upstream.setApiKey(id + "-key");
            properties.getUpstream().put(id, upstream);
        }
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    @Test
    void blsShouldPostSeriesRequestWithRegistrationKey() {
        // Given
        stubFor(post(urlEqualTo("/publicAPI/v2/timeseries/data/"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody(BLS_BODY)));
        var source = new BlsLaborSource(retrofit.create(BlsApi.class), properties);
        var query = source.resolveQuery(Map.of("state", "37", "county", "119", "start", "2023-01", "end", "2024-06"));

        // When
        var body = source.fetch(query).join();

        // Then
        assertThat(body).contains("REQUEST_SUCCEEDED");
        verify(postRequestedFor(urlEqualTo("/publicAPI/v2/timeseries/data/"))
                .withRequestBody(equalToJson("""
                        {"seriesid": ["LAUCN371190000000003"], "startyear": "2023", "endyear": "2024",
                         "registrationkey": "bls-key"}
                        """)));
    }

    @Test
    void blsShouldOmitRegistrationKeyWhenNotConfigured() {
        // Given
        stubFor(post(urlEqualTo("/publicAPI/v2/timeseries/data/"))
                .willReturn(aResponse().withStatus(200).withBody(BLS_BODY)));
        properties.getUpstream().get("bls").setApiKey("");
        var source = new BlsLaborSource(retrofit.create(BlsApi.class), properties);

        // When
        source.fetch(source.resolveQuery(Map.of("state", "37", "county", "119"))).join();

        // Then
        verify(postRequestedFor(urlEqualTo("/publicAPI/v2/timeseries/data/"))
                .withRequestBody(notContaining("registrationkey")));
    }

    @Test
    void shouldSurfaceNonSuccessStatusWithBody() {
        // Given
        stubFor(get(urlPathEqualTo("/crime/fbi/cde/estimate/state/NC"))
                .willReturn(aResponse().withStatus(429).withBody("{\"error\": \"OVER_RATE_LIMIT\"}")));
        var source = new FbiCrimeSource(retrofit.create(FbiCrimeApi.class), properties);

        // When & Then
        assertThatThrownBy(() -> source.fetch(source.resolveQuery(Map.of("state", "nc"))).join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(UpstreamHttpException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(429);
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getBody()).contains("OVER_RATE_LIMIT");
                });
        verify(getRequestedFor(urlPathEqualTo("/crime/fbi/cde/estimate/state/NC"))
                .withQueryParam("from", equalTo("2014"))
                .withQueryParam("to", equalTo("2023"))
                .withQueryParam("api_key", equalTo("fbi-key")));
    }

    @Test
    void beaShouldRequestMetroGdpTable() {
        // Given
        stubFor(get(urlPathEqualTo("/api/data")).willReturn(aResponse().withStatus(200).withBody("{\"BEAAPI\": {}}")));
        var source = new BeaEconomicSource(retrofit.create(BeaRegionalApi.class), properties, clock);

        // When
        source.fetch(source.resolveQuery(Map.of("msa", "16740", "startYear", "2019"))).join();

        // Then
        verify(getRequestedFor(urlPathEqualTo("/api/data"))
                .withQueryParam("UserID", equalTo("bea-key"))
                .withQueryParam("Method", equalTo("GetData"))
                .withQueryParam("TableName", equalTo("CAGDP2"))
                .withQueryParam("GeoFIPS", equalTo("MSA16740"))
                .withQueryParam("Year", equalTo("2019-2024"))
                .withQueryParam("ResultFormat", equalTo("JSON")));
    }

    @Test
    void noaaShouldSendTokenHeader() {
        // Given
        stubFor(get(urlPathEqualTo("/cdo-web/api/v2/data")).willReturn(aResponse().withStatus(200).withBody("{}")));
        var source = new NoaaClimateSource(retrofit.create(NoaaClimateApi.class), properties, clock);

        // When
        var body = source.fetch(source.resolveQuery(Map.of("station", "ghcnd:USW00013881"))).join();

        // Then
        assertThat(body).isEqualTo("{}");
        verify(getRequestedFor(urlPathEqualTo("/cdo-web/api/v2/data"))
                .withHeader("token", equalTo("noaa-key"))
                .withQueryParam("stationid", equalTo("GHCND:USW00013881"))
                .withQueryParam("datatypeid", equalTo("TAVG"))
                .withQueryParam("startdate", equalTo("2023-06-01"))
                .withQueryParam("enddate", equalTo("2024-06-01")));
    }

    @Test
    void foursquareShouldSearchAroundCoordinates() {
        // Given
        stubFor(get(urlPathEqualTo("/v3/places/search")).willReturn(aResponse().withStatus(200).withBody("{\"results\": []}")));
        var source = new FoursquarePlacesSource(retrofit.create(FoursquarePlacesApi.class), properties);

        // When
        source.fetch(source.resolveQuery(Map.of("lat", "35.2271", "lng", "-80.8431", "radius", "800"))).join();

        // Then
        verify(getRequestedFor(urlPathEqualTo("/v3/places/search"))
                .withHeader("Authorization", equalTo("foursquare-key"))
                .withQueryParam("ll", equalTo("35.2271,-80.8431"))
                .withQueryParam("radius", equalTo("800"))
                .withQueryParam("limit", equalTo("50")));
    }

    @Test
    void censusShouldScopeCountyWithinState() {
        // Given
        stubFor(get(urlPathEqualTo("/data/timeseries/poverty/saipe")).willReturn(aResponse().withStatus(204)));
        var source = new CensusDemographicsSource(retrofit.create(CensusSaipeApi.class), properties);

        // When
        var body = source.fetch(source.resolveQuery(Map.of("state", "37", "county", "119"))).join();

        // Then
        assertThat(body).isEmpty();
        verify(getRequestedFor(urlPathEqualTo("/data/timeseries/poverty/saipe"))
                .withQueryParam("get", equalTo("SAEMHI_PT,NAME"))
                .withQueryParam("for", equalTo("county:119"))
                .withQueryParam("in", equalTo("state:37"))
                .withQueryParam("time", equalTo("from 2015 to 2022")));
    }

    @Test
    void hudShouldSendBearerToken() {
        // Given
        stubFor(get(urlPathEqualTo("/hudapi/public/usps")).willReturn(aResponse().withStatus(200).withBody("{\"data\": []}")));
        var source = new HudHousingSource(retrofit.create(HudUspsApi.class), properties);

        // When
        source.fetch(source.resolveQuery(Map.of("zip", "28202"))).join();

        // Then
        verify(getRequestedFor(urlPathEqualTo("/hudapi/public/usps"))
                .withHeader("Authorization", equalTo("Bearer hud-key"))
                .withQueryParam("type", equalTo("3"))
                .withQueryParam("query", equalTo("28202")));
    }
}
