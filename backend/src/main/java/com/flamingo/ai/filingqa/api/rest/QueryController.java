package com.flamingo.ai.filingqa.api.rest;

import com.flamingo.ai.filingqa.api.dto.request.QueryRequest;
import com.flamingo.ai.filingqa.api.dto.response.QueryResponse;
import com.flamingo.ai.filingqa.domain.model.RoutedQuery;
import com.flamingo.ai.filingqa.service.query.QueryRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for routed retrieval. */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

  private final QueryRouter queryRouter;

  /** Routes a question and returns the retrieved passages with their citation metadata. */
  @PostMapping
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    RoutedQuery routed = queryRouter.routeAndRetrieve(request.getQuery(), request.getTopK());
    return ResponseEntity.ok(QueryResponse.fromRoutedQuery(routed));
  }
}
