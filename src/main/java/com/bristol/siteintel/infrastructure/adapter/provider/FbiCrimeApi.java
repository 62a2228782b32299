package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;
import retrofit2.http.Query;

public interface FbiCrimeApi {

    @GET("crime/fbi/cde/estimate/state/{state}")
    Call<ResponseBody> stateEstimates(
            @Path("state") String state,
            @Query("from") int from,
            @Query("to") int to,
            @Query("api_key") String apiKey
    );
}
