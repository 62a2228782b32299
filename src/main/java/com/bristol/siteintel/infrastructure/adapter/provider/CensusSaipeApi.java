package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

public interface CensusSaipeApi {

    @GET("data/timeseries/poverty/saipe")
    Call<ResponseBody> estimates(
            @Query("get") String variables,
            @Query("for") String forGeography,
            @Query("in") String inGeography,
            @Query("time") String time,
            @Query("key") String apiKey
    );
}
