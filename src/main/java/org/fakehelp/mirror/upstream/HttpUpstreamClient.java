/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.upstream;

import org.fakehelp.mirror.conf.Configuration;
import org.fakehelp.mirror.conf.ConfigurationException;
import org.fakehelp.mirror.conf.Key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream client talking JSON over HTTP to a comlink-style service.
 *
 * <p>Operations are {@code POST}s of a JSON object carrying a
 * {@code payload} to a fixed path below the configured base URL, except for
 * the enumeration lookup which is a plain {@code GET}. If both an
 * access key and a secret key are configured, requests are signed with
 * HMAC-SHA256 over request time, method, path and the MD5 digest of the
 * body.</p>
 */
public class HttpUpstreamClient implements UpstreamClient {

  private static final Logger logger = LoggerFactory.getLogger(
      HttpUpstreamClient.class);

  /** Upstream error codes that mean the requested entity does not exist. */
  private static final int[] NOT_FOUND_CODES = { 32, 33 };

  private static final String METHOD = "POST";

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final String baseUrl;

  private final String accessKey;

  private final String secretKey;

  private final int timeoutMillis;

  /** Initialize with the upstream settings of the given configuration. */
  public HttpUpstreamClient(Configuration conf) throws ConfigurationException {
    this(conf.getUrl(Key.UpstreamUrl), conf.getString(Key.AccessKey),
        conf.getString(Key.SecretKey), conf.getInt(Key.UpstreamTimeoutMillis));
  }

  /**
   * Initialize with explicit settings.
   *
   * @param baseUrl Base URL of the upstream service.
   * @param accessKey Access key, or empty to send unsigned requests.
   * @param secretKey Secret key, or empty to send unsigned requests.
   * @param timeoutMillis Read timeout for each request.
   */
  public HttpUpstreamClient(URL baseUrl, String accessKey, String secretKey,
      int timeoutMillis) {
    String base = baseUrl.toString();
    this.baseUrl = base.endsWith("/")
        ? base.substring(0, base.length() - 1) : base;
    this.accessKey = null == accessKey ? "" : accessKey;
    this.secretKey = null == secretKey ? "" : secretKey;
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public Metadata getMetadata() throws UpstreamException {
    JsonNode response = this.post("/metadata", this.request());
    return this.convert(response, Metadata.class);
  }

  @Override
  public Map<String, JsonNode> getGameData(String version,
      boolean includePveUnits, Integer segment) throws UpstreamException {
    ObjectNode request = this.request();
    ObjectNode payload = (ObjectNode) request.get("payload");
    payload.put("version", version);
    payload.put("includePveUnits", includePveUnits);
    if (null != segment) {
      payload.put("requestSegment", segment);
    }
    request.put("enums", false);
    JsonNode response = this.post("/data", request);
    Map<String, JsonNode> collections = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      collections.put(field.getKey(), field.getValue());
    }
    return collections;
  }

  @Override
  public LocalizationBundle getLocalizationBundle(String version,
      boolean unzip) throws UpstreamException {
    ObjectNode request = this.request();
    ((ObjectNode) request.get("payload")).put("id", version);
    request.put("unzip", unzip);
    JsonNode response = this.post("/localization", request);
    if (!unzip) {
      JsonNode archive = response.get("localizationBundle");
      if (null == archive || !archive.isTextual()) {
        throw new UpstreamException(UpstreamException.Kind.UNEXPECTED,
            "Localization response of " + version + " contains no bundle.");
      }
      return LocalizationBundle.ofArchive(archive.asText());
    }
    Map<String, String> files = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isTextual()) {
        files.put(field.getKey(), field.getValue().asText());
      }
    }
    return LocalizationBundle.ofFiles(files);
  }

  @Override
  public JsonNode getPlayer(String allyCode, String playerId)
      throws UpstreamException {
    ObjectNode request = this.request();
    ObjectNode payload = (ObjectNode) request.get("payload");
    if (null != allyCode) {
      payload.put("allyCode", allyCode);
    } else {
      payload.put("playerId", playerId);
    }
    return this.post("/player", request);
  }

  @Override
  public JsonNode getGuild(String guildId,
      boolean includeRecentTerritoryWarResult) throws UpstreamException {
    ObjectNode request = this.request();
    ObjectNode payload = (ObjectNode) request.get("payload");
    payload.put("guildId", guildId);
    payload.put("includeRecentGuildActivityInfo",
        includeRecentTerritoryWarResult);
    return this.post("/guild", request);
  }

  @Override
  public JsonNode getEvents() throws UpstreamException {
    return this.post("/getEvents", this.request());
  }

  @Override
  public List<Segment> getSegmentEnum() throws UpstreamException {
    JsonNode enums = this.post("/enums", null);
    JsonNode segmentEnum = enums.get("GameDataSegment");
    if (null == segmentEnum || !segmentEnum.isObject()) {
      throw new UpstreamException(UpstreamException.Kind.UNEXPECTED,
          "Enumeration GameDataSegment missing in upstream response.");
    }
    List<Segment> segments = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = segmentEnum.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      segments.add(new Segment(field.getKey(), field.getValue().asInt()));
    }
    return segments;
  }

  private ObjectNode request() {
    ObjectNode request = objectMapper.createObjectNode();
    request.putObject("payload");
    return request;
  }

  private <T> T convert(JsonNode node, Class<T> clazz)
      throws UpstreamException {
    try {
      return objectMapper.treeToValue(node, clazz);
    } catch (JsonProcessingException e) {
      throw new UpstreamException(UpstreamException.Kind.UNEXPECTED,
          "Cannot parse " + clazz.getSimpleName() + " from upstream.", e);
    }
  }

  /**
   * Send the given request body to the given path and return the parsed
   * response, or send a {@code GET} if there is no body.
   */
  JsonNode post(String path, JsonNode body) throws UpstreamException {
    byte[] bodyBytes = null;
    try {
      if (null != body) {
        bodyBytes = objectMapper.writeValueAsBytes(body);
      }
      URL url = new URL(this.baseUrl + path);
      logger.debug("Requesting {}.", url);
      HttpURLConnection huc = (HttpURLConnection) url.openConnection();
      String method = null == bodyBytes ? "GET" : METHOD;
      huc.setRequestMethod(method);
      huc.setReadTimeout(this.timeoutMillis);
      huc.setConnectTimeout(this.timeoutMillis);
      huc.setRequestProperty("Accept", "application/json");
      this.sign(huc, method, path, bodyBytes);
      if (null != bodyBytes) {
        huc.setDoOutput(true);
        huc.setRequestProperty("Content-Type", "application/json");
        try (OutputStream out = huc.getOutputStream()) {
          out.write(bodyBytes);
        }
      }
      int response = huc.getResponseCode();
      if (response < 200 || response > 299) {
        throw this.errorFor(path, response, huc.getErrorStream());
      }
      try (InputStream in = huc.getInputStream()) {
        return objectMapper.readTree(readFully(in));
      }
    } catch (JsonProcessingException e) {
      throw new UpstreamException(UpstreamException.Kind.UNEXPECTED,
          "Cannot parse upstream response of " + path + ".", e);
    } catch (IOException e) {
      throw new UpstreamException(UpstreamException.Kind.TRANSIENT,
          "Cannot reach upstream for " + path + ": " + e.getMessage(), e);
    }
  }

  private void sign(HttpURLConnection huc, String method, String path,
      byte[] bodyBytes) {
    if (this.accessKey.isEmpty() || this.secretKey.isEmpty()) {
      return;
    }
    String requestTime = String.valueOf(System.currentTimeMillis());
    huc.setRequestProperty("X-Date", requestTime);
    huc.setRequestProperty("Authorization", "HMAC-SHA256 Credential="
        + this.accessKey + ",Signature="
        + signature(this.secretKey, requestTime, method, path, bodyBytes));
  }

  /**
   * Compute the hex-encoded HMAC-SHA256 request signature.
   */
  static String signature(String secretKey, String requestTime,
      String method, String path, byte[] bodyBytes) {
    String bodyDigest = DigestUtils.md5Hex(
        null == bodyBytes ? new byte[0] : bodyBytes);
    return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secretKey)
        .hmacHex(requestTime + method + path + bodyDigest);
  }

  private UpstreamException errorFor(String path, int status,
      InputStream errorStream) {
    String message = "Upstream answered " + status + " for " + path + ".";
    if (null != errorStream) {
      try (InputStream in = errorStream) {
        JsonNode error = objectMapper.readTree(readFully(in));
        if (null != error && error.hasNonNull("message")) {
          message = error.get("message").asText();
        }
        if (null != error && error.hasNonNull("code")) {
          int code = error.get("code").asInt();
          for (int notFound : NOT_FOUND_CODES) {
            if (notFound == code) {
              return new UpstreamException(UpstreamException.Kind.NOT_FOUND,
                  message);
            }
          }
        }
      } catch (IOException e) {
        logger.debug("Cannot parse error response of {}.", path, e);
      }
    }
    return new UpstreamException(status == 404
        ? UpstreamException.Kind.NOT_FOUND
        : UpstreamException.Kind.SERVER_ERROR, message);
  }

  private static byte[] readFully(InputStream stream) throws IOException {
    ByteArrayOutputStream downloadedBytes = new ByteArrayOutputStream();
    try (BufferedInputStream in = new BufferedInputStream(stream)) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        downloadedBytes.write(data, 0, len);
      }
    }
    return downloadedBytes.toByteArray();
  }
}
