package com.flamingo.ai.memorystore.store.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.store.RecordFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ElasticsearchFilterTranslator Tests")
class ElasticsearchFilterTranslatorTest {

  private final ElasticsearchFilterTranslator translator = new ElasticsearchFilterTranslator();

  @Test
  @DisplayName("should translate all() to match_all")
  void shouldTranslateAll() {
    assertThat(translator.translate(RecordFilter.all()).isMatchAll()).isTrue();
  }

  @Test
  @DisplayName("should translate equality to a term query on the field")
  void shouldTranslateEquality() {
    Query query = translator.translate(RecordFilter.eq(RecordField.SOURCE, "doc.pdf"));

    assertThat(query.isTerm()).isTrue();
    assertThat(query.term().field()).isEqualTo("source");
    assertThat(query.term().value().stringValue()).isEqualTo("doc.pdf");
  }

  @Test
  @DisplayName("should translate and() to bool filter clauses")
  void shouldTranslateAnd() {
    Query query =
        translator.translate(
            RecordFilter.and(
                RecordFilter.eq(RecordField.SOURCE, "doc.pdf"),
                RecordFilter.eq(RecordField.OWNER, "alice")));

    assertThat(query.isBool()).isTrue();
    assertThat(query.bool().filter()).hasSize(2);
    assertThat(query.bool().filter().get(1).term().field()).isEqualTo("ownerId");
  }

  @Test
  @DisplayName("should translate or() to bool should clauses requiring one match")
  void shouldTranslateOr() {
    Query query =
        translator.translate(
            RecordFilter.or(
                RecordFilter.eq(RecordField.OWNER, "alice"),
                RecordFilter.eq(RecordField.VISIBILITY, "SHARED")));

    assertThat(query.bool().should()).hasSize(2);
    assertThat(query.bool().minimumShouldMatch()).isEqualTo("1");
    assertThat(query.bool().filter()).isEmpty();
  }
}
