/*
 * Copyright 2021 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.vperf.app.web;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.error.ErrorAttributeOptions.Include;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@Order(-2)//So that our exception handler gets picked before DefaultErrorWebExceptionHandler
public class RestWebExceptionHandler extends AbstractErrorWebExceptionHandler {

  public RestWebExceptionHandler(
      ErrorAttributes errorAttributes,
      WebProperties webProperties,
      ApplicationContext applicationContext,
      ServerCodecConfigurer serverCodecConfigurer) {
    super(errorAttributes, webProperties.getResources(), applicationContext);
    this.setMessageWriters(serverCodecConfigurer.getWriters());
  }

  @Override
  protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
    return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
  }

  private Mono<ServerResponse> renderErrorResponse(ServerRequest serverRequest) {
    final Throwable error = getError(serverRequest);
    final Map<String, Object> body = getErrorAttributes(serverRequest,
        ErrorAttributeOptions.of(Include.EXCEPTION, Include.MESSAGE));

    if (isBadRequest(error)) {
      // avoid logs cluttering for bad requests
      log.debug("Web request for uri {} was rejected: {}", serverRequest.uri(), error.getMessage());
      body.remove("error");
      body.put("status", HttpStatus.BAD_REQUEST.value());
      if (error instanceof IllegalArgumentException) {
        body.put("message", error.getMessage());
      }
      return ServerResponse.status(HttpStatus.BAD_REQUEST).body(BodyInserters.fromValue(body));
    }

    log.warn("Web request for uri {} failed", serverRequest.uri(), error);
    body.put("message", "Service encountered an unexpected "
        + "condition which prevented it from fulfilling the request.");
    return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(BodyInserters.fromValue(body));
  }

  private static boolean isBadRequest(Throwable error) {
    return error instanceof IllegalArgumentException
        || error instanceof ServerWebInputException
        || error instanceof WebExchangeBindException
        || error instanceof TypeMismatchException;
  }
}
