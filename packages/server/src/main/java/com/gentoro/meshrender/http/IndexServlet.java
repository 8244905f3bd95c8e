package com.gentoro.meshrender.http;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;

/** GET / — serves the bundled upload page. */
public final class IndexServlet extends HttpServlet {
  static final String PAGE = "static/index.html";

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try (InputStream in = IndexServlet.class.getClassLoader().getResourceAsStream(PAGE)) {
      if (in == null) {
        resp.sendError(500, "Could not load page");
        return;
      }
      resp.setStatus(200);
      resp.setContentType("text/html;charset=utf-8");
      in.transferTo(resp.getOutputStream());
    }
  }
}
