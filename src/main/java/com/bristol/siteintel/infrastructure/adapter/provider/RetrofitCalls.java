package com.bristol.siteintel.infrastructure.adapter.provider;

import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Callback;
import retrofit2.Response;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Bridges asynchronous Retrofit calls to futures. Completing the future by any other means
 * (cancellation, timeout) cancels the underlying OkHttp call.
 */
public final class RetrofitCalls {

    private static final Logger logger = LoggerFactory.getLogger(RetrofitCalls.class);

    private RetrofitCalls() {
    }

    public static CompletableFuture<String> bodyOf(Call<ResponseBody> call) {
        var future = new CompletableFuture<String>();
        future.whenComplete((body, error) -> {
            if (error != null && !call.isCanceled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback<>() {
            @Override
            public void onResponse(Call<ResponseBody> c, Response<ResponseBody> response) {
                if (!response.isSuccessful()) {
                    future.completeExceptionally(new UpstreamHttpException(response.code(), readErrorBody(response)));
                    return;
                }
                try (var body = response.body()) {
                    future.complete(body != null ? body.string() : "");
                } catch (IOException e) {
                    future.completeExceptionally(e);
                }
            }

            @Override
            public void onFailure(Call<ResponseBody> c, Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future;
    }

    private static String readErrorBody(Response<ResponseBody> response) {
        try (var errorBody = response.errorBody()) {
            return errorBody != null ? errorBody.string() : "";
        } catch (IOException e) {
            logger.debug("Could not read error body of HTTP {} response: {}", response.code(), e.getMessage());
            return "";
        }
    }
}
