/* Copyright 2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.history;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response of the {@code /api/v1/query_range} endpoint as sent over the wire,
 * e.g.
 * <pre>
 * {"status":"success","data":{"resultType":"matrix","result":[
 *   {"metric":{},"values":[[1685888801,"0"],[1685890601,"0"]]},
 *   {"metric":{"job":"predictions"},"values":[[1685890601,"2"]]}]}}
 * </pre>
 */
class QueryRangeResponse {

  /**
   * Object mapper for parsing responses, tolerating fields added by newer
   * backend versions.
   */
  private static ObjectMapper objectMapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  /**
   * Either {@code "success"} or {@code "error"}.
   */
  @JsonProperty("status")
  String status;

  /**
   * Result data, usually missing if the status is {@code "error"}.
   */
  @JsonProperty("data")
  DataNode data;

  @JsonProperty("errorType")
  String errorType;

  @JsonProperty("error")
  String error;

  /**
   * Warnings about the query execution that do not invalidate the result.
   */
  @JsonProperty("warnings")
  List<String> warnings;

  /** Data part of the response. */
  static class DataNode {

    @JsonProperty("resultType")
    String resultType;

    /**
     * Result whose structure depends on the result type; only matrix results
     * are turned into series.
     */
    @JsonProperty("result")
    JsonNode result;
  }

  /**
   * Decode the given response body.
   *
   * @param body Response body.
   * @return Typed query result.
   * @throws FetchException Thrown with reason
   *     {@link FetchException.Reason#Decode} if the body is not valid JSON or
   *     does not follow the expected schema.
   */
  static RawQueryResult decode(byte[] body) throws FetchException {
    QueryRangeResponse response;
    try {
      response = objectMapper.readValue(body, QueryRangeResponse.class);
    } catch (JsonProcessingException e) {
      throw new FetchException(FetchException.Reason.Decode,
          "Cannot parse response: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new FetchException(FetchException.Reason.Decode,
          "Cannot read response: " + e.getMessage(), e);
    }
    if (null == response) {
      throw new FetchException(FetchException.Reason.Decode,
          "Response body is empty.");
    }
    return response.toRawQueryResult();
  }

  private RawQueryResult toRawQueryResult() throws FetchException {
    RawQueryResult.Status parsedStatus;
    if ("success".equals(this.status)) {
      parsedStatus = RawQueryResult.Status.Success;
    } else if ("error".equals(this.status)) {
      parsedStatus = RawQueryResult.Status.Error;
    } else {
      throw new FetchException(FetchException.Reason.Decode,
          "Unknown response status: " + this.status);
    }
    String resultType = null == this.data ? null : this.data.resultType;
    List<RawSeries> series = Collections.emptyList();
    if (RawQueryResult.MATRIX.equals(resultType)) {
      series = parseMatrix(this.data.result);
    }
    List<String> parsedWarnings = null == this.warnings
        ? Collections.emptyList() : this.warnings;
    return new RawQueryResult(parsedStatus, resultType, series,
        parsedWarnings, this.errorType, this.error);
  }

  private static List<RawSeries> parseMatrix(JsonNode result)
      throws FetchException {
    List<RawSeries> series = new ArrayList<>();
    if (null == result || result.isNull()) {
      return series;
    }
    if (!result.isArray()) {
      throw new FetchException(FetchException.Reason.Decode,
          "Matrix result is not an array.");
    }
    for (JsonNode seriesNode : result) {
      Map<String, String> labels = new TreeMap<>();
      JsonNode metricNode = seriesNode.get("metric");
      if (null != metricNode && metricNode.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> fields = metricNode.fields();
        while (fields.hasNext()) {
          Map.Entry<String, JsonNode> field = fields.next();
          labels.put(field.getKey(), field.getValue().asText());
        }
      }
      JsonNode valuesNode = seriesNode.get("values");
      if (null == valuesNode || !valuesNode.isArray()) {
        throw new FetchException(FetchException.Reason.Decode,
            "Series " + labels + " has no values array.");
      }
      List<RawSample> samples = new ArrayList<>();
      for (JsonNode pair : valuesNode) {
        if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isNumber()
            || !pair.get(1).isValueNode()) {
          throw new FetchException(FetchException.Reason.Decode,
              "Malformed sample in series " + labels + ": " + pair);
        }
        samples.add(new RawSample(pair.get(0).asLong(),
            pair.get(1).asText()));
      }
      series.add(new RawSeries(labels, samples));
    }
    return series;
  }
}
