package com.bristol.siteintel.infrastructure.adapter.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.POST;

import java.util.List;

public interface BlsApi {

    @POST("publicAPI/v2/timeseries/data/")
    Call<ResponseBody> fetchTimeseries(@Body TimeseriesRequest request);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TimeseriesRequest(
            List<String> seriesid,
            String startyear,
            String endyear,
            String registrationkey
    ) {
    }
}
