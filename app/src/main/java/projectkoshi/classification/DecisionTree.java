package projectkoshi.classification;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Árbol de clasificación CART inmutable (impureza de Gini, umbrales en el punto medio).
 * <p>
 * Las clases se representan internamente por su índice en el array ordenado de etiquetas
 * del bosque; {@link #predict(double[])} devuelve ese índice.
 * <p>
 * Una muestra va a la rama izquierda cuando {@code x[feature] <= threshold}.
 */
public final class DecisionTree {

    private final Node root;
    private final int depth;
    private final int nodeCount;

    private DecisionTree(Node root) {
        this.root = root;
        this.depth = root.depth();
        this.nodeCount = root.count();
    }

    /**
     * Índice de clase predicho para un vector de características.
     */
    public int predict(double[] features) {
        Node node = root;
        while (!node.isLeaf()) {
            node = features[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.prediction;
    }

    public int getDepth() {
        return depth;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    /**
     * Ajusta un árbol sobre un subconjunto (posiblemente con repeticiones) de las muestras.
     *
     * @param x                 Matriz de características [muestra][variable].
     * @param y                 Índice de clase de cada muestra.
     * @param classCount        Número de clases distintas.
     * @param bag               Posiciones de las muestras que ve este árbol.
     * @param variablesPerSplit Variables candidatas por nodo (entre 1 y el número de variables).
     * @param minLeafPopulation Población mínima de cada hoja.
     * @param maxDepth          Profundidad máxima (0 = sin límite).
     * @param random            Generador propio del árbol.
     */
    static DecisionTree fit(double[][] x, int[] y, int classCount, int[] bag,
                            int variablesPerSplit, int minLeafPopulation, int maxDepth,
                            SplittableRandom random) {
        Builder builder = new Builder(x, y, classCount, variablesPerSplit,
                Math.max(minLeafPopulation, 1), maxDepth, random);
        return new DecisionTree(builder.grow(bag.clone(), 0));
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int prediction;

        private Node(int feature, double threshold, Node left, Node right, int prediction) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.prediction = prediction;
        }

        static Node leaf(int prediction) {
            return new Node(-1, Double.NaN, null, null, prediction);
        }

        boolean isLeaf() {
            return left == null;
        }

        int depth() {
            return isLeaf() ? 0 : 1 + Math.max(left.depth(), right.depth());
        }

        int count() {
            return isLeaf() ? 1 : 1 + left.count() + right.count();
        }
    }

    /**
     * Estado mutable del crecimiento. Vive sólo durante {@link #fit}.
     */
    private static final class Builder {
        private final double[][] x;
        private final int[] y;
        private final int classCount;
        private final int featureCount;
        private final int variablesPerSplit;
        private final int minLeaf;
        private final int maxDepth;
        private final SplittableRandom random;
        private final int[] featureOrder;

        Builder(double[][] x, int[] y, int classCount, int variablesPerSplit,
                int minLeaf, int maxDepth, SplittableRandom random) {
            this.x = x;
            this.y = y;
            this.classCount = classCount;
            this.featureCount = x[0].length;
            this.variablesPerSplit = Math.min(Math.max(variablesPerSplit, 1), featureCount);
            this.minLeaf = minLeaf;
            this.maxDepth = maxDepth;
            this.random = random;
            this.featureOrder = new int[featureCount];
            for (int f = 0; f < featureCount; f++) {
                featureOrder[f] = f;
            }
        }

        Node grow(int[] samples, int level) {
            int[] counts = classCounts(samples);
            int majority = majority(counts);
            int n = samples.length;

            if (counts[majority] == n || n < 2 * minLeaf || (maxDepth > 0 && level >= maxDepth)) {
                return Node.leaf(majority);
            }

            double parentGini = gini(counts, n);
            int bestFeature = -1;
            double bestThreshold = Double.NaN;
            double bestImpurity = parentGini;

            for (int feature : drawFeatures()) {
                Integer[] order = sortedBy(samples, feature);
                int[] leftCounts = new int[classCount];
                int[] rightCounts = counts.clone();
                for (int i = 0; i < n - 1; i++) {
                    int label = y[order[i]];
                    leftCounts[label]++;
                    rightCounts[label]--;
                    int nLeft = i + 1;
                    int nRight = n - nLeft;
                    double current = x[order[i]][feature];
                    double next = x[order[i + 1]][feature];
                    if (current == next || nLeft < minLeaf || nRight < minLeaf) {
                        continue;
                    }
                    double impurity = (nLeft * gini(leftCounts, nLeft) + nRight * gini(rightCounts, nRight)) / n;
                    if (impurity < bestImpurity - 1e-12) {
                        bestImpurity = impurity;
                        bestFeature = feature;
                        bestThreshold = midpoint(current, next);
                    }
                }
            }

            if (bestFeature < 0) {
                return Node.leaf(majority);
            }

            int leftSize = 0;
            for (int s : samples) {
                if (x[s][bestFeature] <= bestThreshold) {
                    leftSize++;
                }
            }
            int[] left = new int[leftSize];
            int[] right = new int[n - leftSize];
            int l = 0;
            int r = 0;
            for (int s : samples) {
                if (x[s][bestFeature] <= bestThreshold) {
                    left[l++] = s;
                } else {
                    right[r++] = s;
                }
            }
            return new Node(bestFeature, bestThreshold,
                    grow(left, level + 1), grow(right, level + 1), majority);
        }

        /**
         * Subconjunto aleatorio de variables (Fisher-Yates parcial).
         */
        private int[] drawFeatures() {
            for (int i = 0; i < variablesPerSplit; i++) {
                int j = i + random.nextInt(featureCount - i);
                int tmp = featureOrder[i];
                featureOrder[i] = featureOrder[j];
                featureOrder[j] = tmp;
            }
            int[] drawn = Arrays.copyOf(featureOrder, variablesPerSplit);
            // Orden fijo entre las variables elegidas para que los empates se resuelvan igual
            Arrays.sort(drawn);
            return drawn;
        }

        private Integer[] sortedBy(int[] samples, int feature) {
            Integer[] order = new Integer[samples.length];
            for (int i = 0; i < samples.length; i++) {
                order[i] = samples[i];
            }
            Arrays.sort(order, (a, b) -> Double.compare(x[a][feature], x[b][feature]));
            return order;
        }

        private int[] classCounts(int[] samples) {
            int[] counts = new int[classCount];
            for (int s : samples) {
                counts[y[s]]++;
            }
            return counts;
        }
    }

    static int majority(int[] counts) {
        int best = 0;
        for (int c = 1; c < counts.length; c++) {
            if (counts[c] > counts[best]) {
                best = c;
            }
        }
        return best;
    }

    static double gini(int[] counts, int total) {
        if (total == 0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (int count : counts) {
            double p = (double) count / total;
            sumSquares += p * p;
        }
        return 1.0 - sumSquares;
    }

    private static double midpoint(double low, double high) {
        double mid = low + (high - low) / 2.0;
        // Valores contiguos en coma flotante: el punto medio colapsa sobre el superior
        return mid < high ? mid : low;
    }
}
