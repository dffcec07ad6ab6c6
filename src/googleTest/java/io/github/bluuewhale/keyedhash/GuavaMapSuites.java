package io.github.bluuewhale.keyedhash;

import com.google.common.collect.testing.MapTestSuiteBuilder;
import com.google.common.collect.testing.TestMapGenerator;
import com.google.common.collect.testing.TestStringMapGenerator;
import com.google.common.collect.testing.features.CollectionFeature;
import com.google.common.collect.testing.features.CollectionSize;
import com.google.common.collect.testing.features.MapFeature;
import junit.framework.TestSuite;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * guava-testlib Map conformance suites, one per map configuration. Suite names must not
 * contain '(': the builder rejects it.
 */
@NullMarked
final class GuavaMapSuites {
    private GuavaMapSuites() {}

    static List<TestSuite> all() {
        return List.of(
            mapTest("ChainingMap", generator(ChainingMap::new)),
            mapTest("ChainingMap [one bucket]", generator(() -> new ChainingMap<>(1))),
            mapTest("ProbingMap", generator(ProbingMap::new)),
            mapTest("ProbingMap [dense]", generator(() -> new ProbingMap<>(2, 0.9))),
            mapTest("CuckooMap", generator(CuckooMap::new)),
            mapTest("CuckooMap [fixed seeds]",
                generator(() -> new CuckooMap<>(2, SeedableHasher.standard(), SeedSource.fixed(17L))))
        );
    }

    private static TestSuite mapTest(String name, TestMapGenerator<?, ?> generator) {
        return MapTestSuiteBuilder
            .using(generator)
            .named(name)
            .withFeatures(
                CollectionSize.ANY,
                MapFeature.GENERAL_PURPOSE,
                MapFeature.ALLOWS_NULL_VALUES,
                MapFeature.ALLOWS_NULL_ENTRY_QUERIES,
                CollectionFeature.NON_STANDARD_TOSTRING,
                CollectionFeature.SUPPORTS_ITERATOR_REMOVE,
                CollectionFeature.FAILS_FAST_ON_CONCURRENT_MODIFICATION)
            .createTestSuite();
    }

    private static TestStringMapGenerator generator(Supplier<Map<String, String>> supplier) {
        return new TestStringMapGenerator() {
            @Override protected Map<String, String> create(Map.Entry<String, String>[] entries) {
                Map<String, String> map = supplier.get();
                for (Map.Entry<String, String> entry : entries) {
                    map.put(entry.getKey(), entry.getValue());
                }
                return map;
            }
        };
    }
}
