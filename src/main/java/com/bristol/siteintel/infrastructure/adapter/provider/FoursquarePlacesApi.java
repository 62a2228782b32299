package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Header;
import retrofit2.http.Query;

public interface FoursquarePlacesApi {

    @GET("v3/places/search")
    Call<ResponseBody> search(
            @Header("Authorization") String apiKey,
            @Query("ll") String latLng,
            @Query("radius") int radius,
            @Query("categories") String categories,
            @Query("limit") int limit,
            @Query("sort") String sort
    );
}
