package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Header;
import retrofit2.http.Query;

public interface NoaaClimateApi {

    @GET("cdo-web/api/v2/data")
    Call<ResponseBody> stationData(
            @Header("token") String token,
            @Query("datasetid") String datasetId,
            @Query("stationid") String stationId,
            @Query("datatypeid") String dataTypeId,
            @Query("startdate") String startDate,
            @Query("enddate") String endDate,
            @Query("units") String units,
            @Query("limit") int limit
    );
}
