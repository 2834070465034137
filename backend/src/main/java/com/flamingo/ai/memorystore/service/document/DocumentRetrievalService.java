package com.flamingo.ai.memorystore.service.document;

import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import java.util.List;

/** Service for ingesting, retrieving and purging document fragments. */
public interface DocumentRetrievalService {

  /**
   * Embeds and stores all fragments of one source document. Either every fragment is stored or
   * none is.
   *
   * @param fragments the fragments, in document order
   * @param userId the uploading user
   * @param source the source document name
   * @param visibility who may retrieve the fragments
   * @return the stored fragments
   */
  List<DocumentFragment> ingest(
      List<FragmentInput> fragments, String userId, String source, Visibility visibility);

  /**
   * Finds the fragments closest to the query among those the user may see: the user's own and
   * every shared fragment.
   *
   * @param userId the requesting user
   * @param query the query text
   * @param k maximum number of fragments to return
   * @return fragments ordered by ascending distance, each carrying its distance
   */
  List<DocumentFragment> retrieve(String userId, String query, int k);

  /** Lists the distinct (source, uploader) pairs currently stored. */
  List<SourceListing> listSources();

  /** Deletes every fragment of the source, whoever uploaded it. */
  long purgeBySource(String source);

  /** Deletes the fragments of the source uploaded by the user. */
  long purgeBySourceAndUser(String source, String userId);

  /** Deletes every fragment uploaded by the user. */
  long purgeByUser(String userId);

  /** Deletes every fragment. */
  long purgeAll();
}
