package com.yamltest.service.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.infra.TransportException;

/**
 * Renders the Node.js program that performs a request from inside an
 * ephemeral debug container.
 *
 * The request travels as a JSON literal embedded in the program. The program
 * prints the response as one JSON line between {@code HTTP_RESPONSE_START}
 * and {@code HTTP_RESPONSE_END}.
 */
final class DebugRequestScript {

    static final String START_MARKER = "HTTP_RESPONSE_START";
    static final String END_MARKER = "HTTP_RESPONSE_END";

    private static final String TEMPLATE = """
        const http = require('http');
        const https = require('https');
        const cfg = __CONFIG__;
        const target = new URL(cfg.url);
        for (const [k, v] of Object.entries(cfg.params)) {
          target.searchParams.append(k, String(v));
        }
        const options = { method: cfg.method, headers: cfg.headers };
        if (cfg.skipSslVerification) {
          options.rejectUnauthorized = false;
        }
        const emit = (response) => {
          console.log('HTTP_RESPONSE_START');
          console.log(JSON.stringify(response));
          console.log('HTTP_RESPONSE_END');
        };
        const req = (target.protocol === 'https:' ? https : http).request(target, options, (res) => {
          let data = '';
          res.setEncoding('utf8');
          res.on('data', (chunk) => { data += chunk; });
          res.on('end', () => {
            let body;
            try { body = JSON.parse(data); } catch (e) { body = data; }
            emit({ statusCode: res.statusCode, headers: res.headers, body: body });
          });
        });
        req.on('error', (error) => {
          console.error('Error making request:', error.message);
          emit({ error: true, message: error.message, statusCode: 0, headers: {}, body: null });
        });
        if (cfg.body !== null) {
          req.write(cfg.body);
        }
        req.end();
        """;

    private DebugRequestScript() {
    }

    static String render(ObjectMapper mapper, HttpRequestSpec request) {
        ObjectNode cfg = mapper.createObjectNode();
        cfg.put("url", request.fullUrl());
        cfg.put("method", request.method().toUpperCase());
        ObjectNode headers = cfg.putObject("headers");
        request.headers().forEach(headers::put);
        String body = ResponseBodies.serialize(request.body());
        if (body != null && !request.body().isTextual()
                && request.headers().keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
            headers.put("Content-Type", "application/json");
        }
        ObjectNode params = cfg.putObject("params");
        request.params().forEach(params::put);
        cfg.put("body", body);
        cfg.put("skipSslVerification", request.skipSslVerification());
        try {
            return TEMPLATE.replace("__CONFIG__", mapper.writeValueAsString(cfg));
        } catch (JsonProcessingException e) {
            throw new TransportException("Could not render in-pod request: " + e.getOriginalMessage(), e);
        }
    }
}
