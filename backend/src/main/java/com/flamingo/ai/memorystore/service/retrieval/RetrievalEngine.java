package com.flamingo.ai.memorystore.service.retrieval;

import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import com.flamingo.ai.memorystore.service.document.FragmentInput;
import com.flamingo.ai.memorystore.service.document.SourceListing;
import java.util.List;

/**
 * Entry point for conversation memory and document retrieval.
 *
 * <p>Every operation validates its input and reports failures as either {@link
 * com.flamingo.ai.memorystore.exception.RetrievalUnavailableException} (a dependency is down, retry
 * later) or {@link com.flamingo.ai.memorystore.exception.RetrievalRejectedException} (the request
 * itself is wrong). Missing data is an empty result, never an error.
 */
public interface RetrievalEngine {

  ConversationTurn recordTurn(String userId, String text);

  /**
   * Finds the user's turns closest to the query.
   *
   * @param userId the user ID
   * @param query the query text
   * @param k maximum results, or null for the configured default
   * @return turns ordered by ascending distance
   */
  List<ConversationTurn> recall(String userId, String query, Integer k);

  List<ConversationTurn> history(String userId);

  long clearHistory(String userId);

  long clearAllHistory();

  List<String> usersWithHistory();

  long historyCount(String userId);

  /**
   * Stores all fragments of one source document for the user. Nothing is stored on failure.
   *
   * @param fragments the fragments, at least one
   * @param userId the uploading user
   * @param source the source document name
   * @param visibility who may retrieve the fragments
   * @return the stored fragments
   */
  List<DocumentFragment> ingest(
      List<FragmentInput> fragments, String userId, String source, Visibility visibility);

  /**
   * Finds the fragments closest to the query among the user's own and all shared fragments.
   *
   * @param userId the requesting user
   * @param query the query text
   * @param k maximum results, or null for the configured default
   * @return fragments ordered by ascending distance
   */
  List<DocumentFragment> retrieve(String userId, String query, Integer k);

  List<SourceListing> listSources();

  long purgeBySource(String source);

  long purgeBySourceAndUser(String source, String userId);

  long purgeByUser(String userId);

  long purgeAll();
}
