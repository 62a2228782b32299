package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.QueryMap;

import java.util.Map;

public interface BeaRegionalApi {

    @GET("api/data")
    Call<ResponseBody> regionalData(@QueryMap Map<String, String> params);
}
