package com.flamingo.ai.memorystore.service.memory;

import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import java.util.List;

/** Bounded per-user conversation history with semantic recall. */
public interface ConversationMemoryService {

  /**
   * Stores a turn for the user, evicting the user's oldest turns so that at most the configured
   * history capacity remains.
   *
   * @param userId the user ID
   * @param text the turn text
   * @return the stored turn
   */
  ConversationTurn recordTurn(String userId, String text);

  /**
   * Finds the user's turns closest to the query.
   *
   * @param userId the user ID
   * @param query the query text
   * @param k maximum number of turns to return
   * @return turns ordered by ascending distance, each carrying its distance
   */
  List<ConversationTurn> recall(String userId, String query, int k);

  /**
   * Gets all stored turns of the user in chronological order.
   *
   * @param userId the user ID
   * @return the user's turns, oldest first
   */
  List<ConversationTurn> history(String userId);

  /**
   * Deletes every turn of the user.
   *
   * @param userId the user ID
   * @return number of turns removed
   */
  long clear(String userId);

  /**
   * Deletes every turn of every user.
   *
   * @return number of turns removed
   */
  long clearAll();

  /** Gets the ids of users that have at least one stored turn. */
  List<String> usersWithHistory();

  /** Counts the stored turns of the user. */
  long count(String userId);
}
