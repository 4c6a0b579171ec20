package com.yescount.planner.infrastructure.adapter.provider;

import com.yescount.planner.infrastructure.adapter.provider.json.OpenDataEventJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Header;
import retrofit2.http.Path;
import retrofit2.http.Query;

import java.util.List;

/**
 * Socrata resource endpoint of the NYC Open Data portal.
 */
public interface OpenDataApi {

    /**
     * Fetches one page of a dataset. The endpoint answers with a JSON array; an empty array
     * means the offset is past the end of the dataset.
     *
     * @param datasetId dataset identifier, e.g. {@code tvpp-9vvx}
     * @param appToken  Socrata app token, omitted from the request when null
     * @param limit     page size
     * @param offset    rows to skip
     * @return a {@code Call} for the page
     */
    @GET("resource/{dataset}.json")
    Call<List<OpenDataEventJson>> fetchPage(
            @Path("dataset") String datasetId,
            @Header("X-App-Token") String appToken,
            @Query(value = "$limit", encoded = true) int limit,
            @Query(value = "$offset", encoded = true) int offset);
}
