package com.gentoro.meshrender.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.meshrender.exception.ErrorDetails;
import com.gentoro.meshrender.exception.ExceptionUtil;
import com.gentoro.meshrender.submission.SubmissionResult;
import com.gentoro.meshrender.submission.SubmissionService;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.Part;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;

/**
 * POST /upload
 *
 * <p>Accepts an STL file either as the multipart field {@code file} or as the raw request body.
 * Already rendered content answers {@code 200}:
 *
 * <pre>
 * {"status":"cached","fingerprint":"...","output":"/output/output-....png"}
 * </pre>
 *
 * <p>New content answers {@code 202}; the client then opens {@code /ws} and sends the job id:
 *
 * <pre>
 * {"status":"accepted","jobId":"...","fingerprint":"...","output":"/output/output-....png"}
 * </pre>
 *
 * <p>Raw bodies larger than the configured limit answer {@code 413}; multipart uploads are bounded
 * by the servlet's multipart configuration.
 */
public final class UploadServlet extends HttpServlet {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(UploadServlet.class);

  static final String FILE_FIELD = "file";
  public static final long DEFAULT_MAX_BYTES = 100L * 1024 * 1024;

  private final SubmissionService submissions;
  private final long maxBytes;
  private final ObjectMapper mapper = new ObjectMapper();

  public UploadServlet(SubmissionService submissions) {
    this(submissions, DEFAULT_MAX_BYTES);
  }

  public UploadServlet(SubmissionService submissions, long maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
    }
    this.submissions = submissions;
    this.maxBytes = maxBytes;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!isMultipart(req) && req.getContentLengthLong() > maxBytes) {
      writeError(resp, 413, tooLargeMessage());
      return;
    }

    SubmissionResult result;
    try (InputStream content = openContent(req)) {
      if (content == null) {
        writeError(resp, 400, "Missing form field '" + FILE_FIELD + "'");
        return;
      }
      result = submissions.submit(content);
    } catch (Exception e) {
      if (ExceptionUtils.indexOfType(e, UploadTooLargeException.class) >= 0) {
        log.warn("Rejected upload over {} bytes", maxBytes);
        writeError(resp, 413, tooLargeMessage());
        return;
      }
      log.error("Upload failed: {}", e.getMessage(), e);
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      writeError(resp, 500, "Failed to accept upload: " + details.message());
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    if (result.isCached()) {
      node.put("status", "cached");
      resp.setStatus(200);
    } else {
      node.put("status", "accepted");
      node.put("jobId", result.jobId());
      resp.setStatus(202);
    }
    node.put("fingerprint", result.fingerprint().hex());
    node.put("output", result.outputLink());

    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }

  @Override
  protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    doPost(req, resp);
  }

  private InputStream openContent(HttpServletRequest req) throws IOException, ServletException {
    if (isMultipart(req)) {
      Part part = req.getPart(FILE_FIELD);
      return part == null ? null : part.getInputStream();
    }
    return new CappedBody(req.getInputStream(), maxBytes);
  }

  private static boolean isMultipart(HttpServletRequest req) {
    String contentType = req.getContentType();
    return contentType != null && contentType.toLowerCase().startsWith("multipart/form-data");
  }

  private String tooLargeMessage() {
    return "Upload exceeds the limit of " + maxBytes + " bytes";
  }

  /** Request body that fails as soon as more than {@code maxBytes} have been read. */
  static final class CappedBody extends BoundedInputStream {
    private final long maxBytes;

    CappedBody(InputStream in, long maxBytes) {
      super(in, maxBytes + 1);
      this.maxBytes = maxBytes;
    }

    @Override
    protected void onMaxLength(long maxLength, long count) throws IOException {
      throw new UploadTooLargeException(maxBytes);
    }
  }

  static final class UploadTooLargeException extends IOException {
    UploadTooLargeException(long maxBytes) {
      super("Upload exceeds " + maxBytes + " bytes");
    }
  }

  private void writeError(HttpServletResponse resp, int status, String message)
      throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("error", message);
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
