package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Header;
import retrofit2.http.Query;

public interface HudUspsApi {

    @GET("hudapi/public/usps")
    Call<ResponseBody> vacancy(
            @Header("Authorization") String bearerToken,
            @Query("type") int type,
            @Query("query") String zip,
            @Query("year") int year
    );
}
