package com.flamingo.ai.memorystore.store.elasticsearch;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.flamingo.ai.memorystore.store.RecordFilter;
import java.util.List;

/** Translates a {@link RecordFilter} tree into an Elasticsearch filter-context query. */
public class ElasticsearchFilterTranslator {

  /**
   * Builds the query for a filter.
   *
   * @param filter the record predicate
   * @return an equivalent non-scoring query
   */
  public Query translate(RecordFilter filter) {
    if (filter instanceof RecordFilter.All) {
      return Query.of(q -> q.matchAll(m -> m));
    }
    if (filter instanceof RecordFilter.FieldEquals eq) {
      return Query.of(q -> q.term(t -> t.field(eq.field().getFieldName()).value(eq.value())));
    }
    if (filter instanceof RecordFilter.And and) {
      List<Query> operands = translateAll(and.operands());
      return Query.of(q -> q.bool(b -> b.filter(operands)));
    }
    if (filter instanceof RecordFilter.Or or) {
      List<Query> operands = translateAll(or.operands());
      return Query.of(q -> q.bool(b -> b.should(operands).minimumShouldMatch("1")));
    }
    throw new IllegalArgumentException("Unsupported filter: " + filter);
  }

  private List<Query> translateAll(List<RecordFilter> filters) {
    return filters.stream().map(this::translate).toList();
  }
}
