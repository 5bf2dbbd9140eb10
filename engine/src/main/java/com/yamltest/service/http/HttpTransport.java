package com.yamltest.service.http;

import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.domain.Source;
import com.yamltest.dto.HttpResponseData;

/**
 * One way of delivering a prepared request. Non-2xx responses are returned,
 * not thrown; only failures to obtain a response raise.
 */
public interface HttpTransport {

    HttpResponseData send(HttpRequestSpec request, Source source);
}
