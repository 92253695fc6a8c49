package ch.so.arp.recall.memory;

import java.util.List;
import java.util.Optional;

/**
 * Operations on one opened collection.
 */
public interface CollectionHandle {

    String name();

    /**
     * Run a hybrid or near text query.
     *
     * @return matching objects in the relevance order of the store
     */
    List<StoredObject> query(String query, SearchOptions options);

    /**
     * Retrieve with the given options and let the store compose a single text
     * from all retrieved objects.
     *
     * @param groupedTask task prompt applied to the whole result group
     * @return the generated text, or empty when the store produced none
     */
    Optional<String> generate(String query, SearchOptions options, String groupedTask);

    /**
     * @return the identifier of the stored object
     */
    String insert(StoredObject object);

    BatchInsertResult insertMany(List<StoredObject> objects);

    long count();
}
