/* Copyright 2019--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.monitor.downloader;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Utility class for posting forms to HTTP servers.
 */
public class Downloader {

  private static final String FORM_CONTENT_TYPE
      = "application/x-www-form-urlencoded";

  private static final int CONNECT_TIMEOUT_MILLIS = 5000;

  private static final int READ_TIMEOUT_MILLIS = 30000;

  /**
   * Post the given form parameters to an HTTP server and return the bytes of
   * the response body.
   *
   * <p>The body of error responses is returned as well, because some servers
   * describe the error in a machine-readable body.</p>
   *
   * @param url URL to post to.
   * @param form Form parameters in the order they should be sent.
   * @return Response body, or {@code null} if the server did not send one.
   * @throws IOException Thrown if anything goes wrong while connecting,
   *     sending, or receiving.
   */
  public static byte[] postFormToHttpServer(URL url, Map<String, String> form)
      throws IOException {
    byte[] requestBody = encodeForm(form).getBytes(StandardCharsets.US_ASCII);
    HttpURLConnection huc = (HttpURLConnection) url.openConnection();
    huc.setRequestMethod("POST");
    huc.setConnectTimeout(CONNECT_TIMEOUT_MILLIS);
    huc.setReadTimeout(READ_TIMEOUT_MILLIS);
    huc.setDoOutput(true);
    huc.setRequestProperty("Content-Type", FORM_CONTENT_TYPE);
    huc.setFixedLengthStreamingMode(requestBody.length);
    huc.connect();
    try (OutputStream out = huc.getOutputStream()) {
      out.write(requestBody);
    }
    int response = huc.getResponseCode();
    InputStream body = response >= 400 ? huc.getErrorStream()
        : huc.getInputStream();
    if (null == body) {
      return null;
    }
    ByteArrayOutputStream downloadedBytes = new ByteArrayOutputStream();
    try (BufferedInputStream in = new BufferedInputStream(body)) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        downloadedBytes.write(data, 0, len);
      }
    }
    return downloadedBytes.toByteArray();
  }

  /**
   * Encode the given parameters as {@code application/x-www-form-urlencoded}
   * string.
   *
   * @param form Form parameters.
   * @return Encoded form, e.g. {@code a=1&b=x+y}.
   */
  public static String encodeForm(Map<String, String> form) {
    StringBuilder sb = new StringBuilder();
    try {
      for (Map.Entry<String, String> e : form.entrySet()) {
        if (sb.length() > 0) {
          sb.append('&');
        }
        sb.append(URLEncoder.encode(e.getKey(), "UTF-8")).append('=')
            .append(URLEncoder.encode(e.getValue(), "UTF-8"));
      }
    } catch (UnsupportedEncodingException uee) {
      throw new IllegalStateException("UTF-8 is always supported.", uee);
    }
    return sb.toString();
  }
}
