package projectkoshi.classification;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.config.AnalysisConfig.ClassifierConfig;
import projectkoshi.domain.classification.TrainingSample;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class RandomForestTrainerTest {

    private TileProcessor tileProcessor;
    private RandomForestTrainer trainer;

    @BeforeEach
    void setUp() {
        tileProcessor = new TileProcessor(4, 64);
        trainer = new RandomForestTrainer(ClassifierConfig.builder().treeCount(25).seed(7L).build(), tileProcessor);
    }

    @AfterEach
    void tearDown() {
        tileProcessor.close();
    }

    /**
     * Dos nubes de puntos separadas en las seis bandas.
     */
    private static List<TrainingSample> separableSamples(long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        List<TrainingSample> samples = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            int label = i % 2;
            double[] features = new double[6];
            for (int f = 0; f < 6; f++) {
                features[f] = (label == 1 ? 2000 : 200) + random.nextDouble(0, 100);
            }
            samples.add(new TrainingSample(features, label));
        }
        return samples;
    }

    @Test
    @DisplayName("Clases separables se clasifican sin error sobre el entrenamiento")
    void separableClasses_shouldHaveZeroTrainingError() {
        // ARRANGE
        List<TrainingSample> samples = separableSamples(1);

        // ACT
        RandomForestModel model = trainer.train(samples);

        // ASSERT
        assertEquals(25, model.getTreeCount());
        assertEquals(0.0, model.errorRate(samples));
        assertEquals(0.0, model.errorRate(separableSamples(2)), "Los puntos no vistos también deben acertarse");
        assertEquals(1, model.classify(new double[]{2050, 2050, 2050, 2050, 2050, 2050}));
        assertEquals(0, model.classify(new double[]{250, 250, 250, 250, 250, 250}));
    }

    @Test
    @DisplayName("La misma semilla produce el mismo modelo aunque los árboles se entrenen en paralelo")
    void sameSeed_shouldBeReproducible() {
        List<TrainingSample> samples = new ArrayList<>(separableSamples(3));
        // Muestras ruidosas para que los árboles difieran entre sí
        SplittableRandom random = new SplittableRandom(11);
        for (int i = 0; i < 30; i++) {
            double[] features = new double[6];
            for (int f = 0; f < 6; f++) {
                features[f] = random.nextDouble(0, 2500);
            }
            samples.add(new TrainingSample(features, random.nextInt(3)));
        }

        RandomForestModel first = trainer.train(samples);
        RandomForestModel second = trainer.train(samples);

        SplittableRandom queries = new SplittableRandom(99);
        for (int i = 0; i < 200; i++) {
            double[] query = new double[6];
            for (int f = 0; f < 6; f++) {
                query[f] = queries.nextDouble(0, 2500);
            }
            assertEquals(first.classify(query), second.classify(query));
        }
    }

    @Test
    @DisplayName("Un conjunto con una sola clase no se puede entrenar")
    void singleClass_shouldFail() {
        List<TrainingSample> oneClass = List.of(
                new TrainingSample(new double[]{1, 2}, 1),
                new TrainingSample(new double[]{3, 4}, 1));

        assertThrows(IllegalArgumentException.class, () -> trainer.train(oneClass));
    }

    @Test
    @DisplayName("Entradas degeneradas se rechazan antes de entrenar")
    void degenerateInput_shouldFail() {
        List<TrainingSample> mixedLengths = List.of(
                new TrainingSample(new double[]{1, 2}, 0),
                new TrainingSample(new double[]{3}, 1));
        List<TrainingSample> valid = separableSamples(5);

        assertThrows(IllegalArgumentException.class, () -> trainer.train(List.of()));
        assertThrows(IllegalArgumentException.class, () -> trainer.train(mixedLengths));
        assertThrows(IllegalArgumentException.class, () -> trainer.train(valid, 0));
    }

    @Test
    @DisplayName("Las etiquetas del modelo se guardan ordenadas aunque no sean consecutivas")
    void classes_shouldBeSortedLabels() {
        // ARRANGE
        List<TrainingSample> samples = List.of(
                new TrainingSample(new double[]{10}, 5),
                new TrainingSample(new double[]{0}, 3),
                new TrainingSample(new double[]{20}, 5));
        RandomForestTrainer single = new RandomForestTrainer(
                ClassifierConfig.builder().treeCount(1).maxDepth(1).build(), tileProcessor);

        // ACT
        RandomForestModel model = single.train(samples);

        // ASSERT
        assertArrayEquals(new int[]{3, 5}, model.getClasses());
        assertEquals(1, model.getFeatureCount());
        int predicted = model.classify(new double[]{0});
        assertTrue(predicted == 3 || predicted == 5);
        assertThrows(IllegalArgumentException.class, () -> model.classify(new double[]{0, 1}));
    }

    @Test
    @DisplayName("El voto mayoritario resuelve los empates hacia el índice de clase más bajo")
    void majority_shouldPickFirstMaximum() {
        assertEquals(0, DecisionTree.majority(new int[]{2, 2}));
        assertEquals(1, DecisionTree.majority(new int[]{1, 3, 3}));
        assertEquals(0.5, DecisionTree.gini(new int[]{5, 5}, 10), 1e-12);
        assertEquals(0.0, DecisionTree.gini(new int[]{0, 7}, 7), 1e-12);
    }
}
