package eu.virtualparadox.flockqa.rag.index;

import eu.virtualparadox.flockqa.rag.retriever.model.SearchHits;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import static eu.virtualparadox.flockqa.util.LuceneConstants.FIELD_ORDINAL;
import static eu.virtualparadox.flockqa.util.LuceneConstants.FIELD_VECTOR;

/**
 * {@link SimilarityIndex} backed by a Lucene HNSW graph.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code vector} – {@code KnnFloatVectorField}: dense vector</li>
 *   <li>{@code ordinal} – {@code StoredField}: position of the record in the partition's document list</li>
 * </ul>
 *
 * <p>Lucene reports similarities, higher is better. Scores are converted back to squared L2
 * distances so callers can apply a single distance-to-relevance transform whatever similarity
 * function the index was built with. For the cosine and inner-product functions the conversion
 * assumes unit vectors.</p>
 */
@Slf4j
public final class LuceneSimilarityIndex implements SimilarityIndex {

    private static final Set<String> ORDINAL_ONLY = Set.of(FIELD_ORDINAL);

    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final VectorSimilarityFunction similarity;
    private final Integer dimension;

    private LuceneSimilarityIndex(final Directory directory, final DirectoryReader reader) {
        this.directory = directory;
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);

        final FieldInfo vectorField = FieldInfos.getMergedFieldInfos(reader).fieldInfo(FIELD_VECTOR);
        if (vectorField == null || vectorField.getVectorDimension() == 0) {
            this.dimension = null;
            this.similarity = VectorSimilarityFunction.EUCLIDEAN;
        } else {
            this.dimension = vectorField.getVectorDimension();
            this.similarity = vectorField.getVectorSimilarityFunction();
        }
    }

    /**
     * Opens the index stored under {@code path}.
     *
     * @param path Lucene index directory
     * @return an open index; the caller owns it and must close it
     * @throws IOException if the directory holds no readable index
     */
    public static LuceneSimilarityIndex open(final Path path) throws IOException {
        final Directory dir = FSDirectory.open(path);
        try {
            return new LuceneSimilarityIndex(dir, DirectoryReader.open(dir));
        } catch (IOException | RuntimeException e) {
            dir.close();
            throw e;
        }
    }

    @Override
    public int size() {
        return reader.numDocs();
    }

    @Override
    public Integer dimension() {
        return dimension;
    }

    @Override
    public SearchHits search(final float[] query, final int k) throws IOException {
        if (dimension == null || k <= 0 || size() == 0) {
            return SearchHits.empty();
        }
        if (query.length != dimension) {
            throw new IllegalArgumentException("Query dimension " + query.length + " != index dimension " + dimension);
        }

        final int n = Math.min(k, size());
        final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, query, n), n);
        final StoredFields storedFields = searcher.storedFields();

        final float[] distances = new float[topDocs.scoreDocs.length];
        final int[] indices = new int[topDocs.scoreDocs.length];
        for (int i = 0; i < topDocs.scoreDocs.length; i++) {
            final ScoreDoc sd = topDocs.scoreDocs[i];
            final Document doc = storedFields.document(sd.doc, ORDINAL_ONLY);
            final IndexableField ordinal = doc.getField(FIELD_ORDINAL);
            indices[i] = ordinal == null ? -1 : ordinal.numericValue().intValue();
            distances[i] = toSquaredDistance(sd.score);
        }
        return new SearchHits(distances, indices);
    }

    private float toSquaredDistance(final float score) {
        final double distance = switch (similarity) {
            case EUCLIDEAN -> score <= 0f ? Double.MAX_VALUE : (1.0 / score) - 1.0;
            case COSINE, DOT_PRODUCT -> 4.0 * (1.0 - score);
            case MAXIMUM_INNER_PRODUCT -> {
                final double ip = score >= 1f ? score - 1.0 : 1.0 - (1.0 / score);
                yield 2.0 - 2.0 * ip;
            }
        };
        return (float) Math.max(0.0, distance);
    }

    @Override
    public void close() throws IOException {
        try {
            reader.close();
        } finally {
            directory.close();
        }
    }
}
