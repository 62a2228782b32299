package com.bristol.siteintel.infrastructure.config;

import com.bristol.siteintel.infrastructure.adapter.provider.BeaEconomicSource;
import com.bristol.siteintel.infrastructure.adapter.provider.BeaRegionalApi;
import com.bristol.siteintel.infrastructure.adapter.provider.BlsApi;
import com.bristol.siteintel.infrastructure.adapter.provider.BlsLaborSource;
import com.bristol.siteintel.infrastructure.adapter.provider.CensusDemographicsSource;
import com.bristol.siteintel.infrastructure.adapter.provider.CensusSaipeApi;
import com.bristol.siteintel.infrastructure.adapter.provider.FbiCrimeApi;
import com.bristol.siteintel.infrastructure.adapter.provider.FbiCrimeSource;
import com.bristol.siteintel.infrastructure.adapter.provider.FoursquarePlacesApi;
import com.bristol.siteintel.infrastructure.adapter.provider.FoursquarePlacesSource;
import com.bristol.siteintel.infrastructure.adapter.provider.HudHousingSource;
import com.bristol.siteintel.infrastructure.adapter.provider.HudUspsApi;
import com.bristol.siteintel.infrastructure.adapter.provider.NoaaClimateApi;
import com.bristol.siteintel.infrastructure.adapter.provider.NoaaClimateSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

import java.util.concurrent.TimeUnit;

/**
 * One Retrofit interface per upstream, all sharing a single OkHttp client. Attempt timeouts are
 * enforced on the futures, so the client only bounds connection setup.
 */
@Configuration
public class RetrofitProviderConfig {

    @Bean
    public OkHttpClient upstreamHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public BlsApi blsApi(OkHttpClient client, ObjectMapper objectMapper, UpstreamProperties properties) {
        return retrofit(properties.baseUrl(BlsLaborSource.ID), client, objectMapper).create(BlsApi.class);
    }

    @Bean
    public FbiCrimeApi fbiCrimeApi(OkHttpClient client, ObjectMapper objectMapper, UpstreamProperties properties) {
        return retrofit(properties.baseUrl(FbiCrimeSource.ID), client, objectMapper).create(FbiCrimeApi.class);
    }

    @Bean
    public BeaRegionalApi beaRegionalApi(OkHttpClient client, ObjectMapper objectMapper, UpstreamProperties properties) {
        return retrofit(properties.baseUrl(BeaEconomicSource.ID), client, objectMapper).create(BeaRegionalApi.class);
    }

    @Bean
    public NoaaClimateApi noaaClimateApi(OkHttpClient client, ObjectMapper objectMapper, UpstreamProperties properties) {
        return retrofit(properties.baseUrl(NoaaClimateSource.ID), client, objectMapper).create(NoaaClimateApi.class);
    }

    @Bean
    public FoursquarePlacesApi foursquarePlacesApi(OkHttpClient client, ObjectMapper objectMapper,
                                                   UpstreamProperties properties) {
        return retrofit(properties.baseUrl(FoursquarePlacesSource.ID), client, objectMapper)
                .create(FoursquarePlacesApi.class);
    }

    @Bean
    public CensusSaipeApi censusSaipeApi(OkHttpClient client, ObjectMapper objectMapper, UpstreamProperties properties) {
        return retrofit(properties.baseUrl(CensusDemographicsSource.ID), client, objectMapper)
                .create(CensusSaipeApi.class);
    }

    @Bean
    public HudUspsApi hudUspsApi(OkHttpClient client, ObjectMapper objectMapper, UpstreamProperties properties) {
        return retrofit(properties.baseUrl(HudHousingSource.ID), client, objectMapper).create(HudUspsApi.class);
    }

    private static Retrofit retrofit(String baseUrl, OkHttpClient client, ObjectMapper objectMapper) {
        return new Retrofit.Builder()
                .baseUrl(baseUrl)
                .client(client)
                .addConverterFactory(JacksonConverterFactory.create(objectMapper))
                .build();
    }
}
