package com.termdag.bus;

import java.util.Arrays;
import java.util.PriorityQueue;

import lombok.extern.log4j.Log4j2;

/**
 * Routes every logical connection of a {@link Bus} along disjoint shortest
 * paths.
 *
 * <h3>Routing grid</h3>
 * For a trial height {@code h} the grid has {@code width x h} cells, each with
 * two graph vertices (a vertical lane and a horizontal lane) and up to three
 * lane edges:
 * <ul>
 * <li>vertical: cell to the cell below, cost 1, every row but the last;</li>
 * <li>horizontal: cell to the cell on the right, cost 1, only on rows
 * {@code 1 .. h-3};</li>
 * <li>corner: vertical lane to horizontal lane of the same cell, cost
 * {@code 10 + d*d} where {@code d} is the distance from the middle row, so
 * turns gravitate to the center of the bus.</li>
 * </ul>
 *
 * <h3>Search</h3>
 * Connections are routed in id order. Each one is a multi-source Dijkstra
 * from the top of every input column to the bottom of every output column,
 * over lane edges no earlier connection has claimed. The cheapest target is
 * traced back and its edges are claimed. Perpendicular lanes at claimed cells
 * then cost {@value #CROSSING_PENALTY} so later paths avoid running over a
 * stroke without a visible junction.
 *
 * <p>
 * If a connection cannot reach any target the whole bus is retried one row
 * taller. Past the height ceiling the partial routing is accepted as is, so
 * routing always terminates.
 */
@Log4j2
public final class BusRouter {
    static final int UNREACHABLE = Integer.MAX_VALUE / 2;
    static final int CROSSING_PENALTY = 20;

    private static final int VERTICAL = 0;
    private static final int HORIZONTAL = 1;
    private static final int CORNER = 2;

    private final int minHeight;
    private final int maxHeight;

    public BusRouter(int minHeight, int maxHeight) {
        if (minHeight < 3)
            throw new IllegalArgumentException("Bus height must be at least 3: " + minHeight);
        this.minHeight = minHeight;
        this.maxHeight = maxHeight;
    }

    /**
     * Solves the bus in place: sets its height and raster.
     *
     * @return the accepted height.
     */
    public int route(Bus bus) {
        final int width = bus.width();
        final int connections = bus.connectionCount();

        for (int height = minHeight;; height++) {
            RoutingGrid grid = new RoutingGrid(width, height);
            int failedAt = 0;
            for (int c = 1; c <= connections; c++) {
                if (!grid.route(bus, c)) {
                    failedAt = c;
                    break;
                }
            }

            boolean forced = false;
            if (failedAt != 0) {
                if (height <= maxHeight) {
                    log.debug("Bus of width {} cannot route connection {} at height {}, growing", width, failedAt,
                            height);
                    continue;
                }
                forced = true;
                log.warn("Bus of width {} still cannot route connection {} of {} at height {}; accepting partial routing",
                        width, failedAt, connections, height);
            }
            bus.solved(height, grid.raster(), forced);
            return height;
        }
    }

    /**
     * One trial grid. Lane edges are stored structure-of-arrays, indexed by
     * {@code x + width * (y + height * lane)}.
     */
    private static final class RoutingGrid {
        private final int width;
        private final int height;

        // Lane edges
        private final int[] edgeA;
        private final int[] edgeB;
        private final int[] weight;
        private final int[] assigned;

        // Lane vertices: each touches at most 3 edges
        private final int[][] incident;
        private final int[] degree;
        private final int[] cost;
        private final boolean[] visited;
        private final boolean[] isStart;

        RoutingGrid(int width, int height) {
            this.width = width;
            this.height = height;
            int vertexCount = width * height * 2;
            int edgeCount = width * height * 3;
            this.edgeA = new int[edgeCount];
            this.edgeB = new int[edgeCount];
            this.weight = new int[edgeCount];
            this.assigned = new int[edgeCount];
            this.incident = new int[vertexCount][3];
            this.degree = new int[vertexCount];
            this.cost = new int[vertexCount];
            this.visited = new boolean[vertexCount];
            this.isStart = new boolean[vertexCount];

            int mid = height / 2;
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (y != height - 1)
                        connect(index(x, y, VERTICAL), index(x, y, VERTICAL), index(x, y + 1, VERTICAL), 1);
                    if (y >= 1 && y <= height - 3 && x != width - 1)
                        connect(index(x, y, HORIZONTAL), index(x, y, HORIZONTAL), index(x + 1, y, HORIZONTAL), 1);
                    int dy = mid - y;
                    connect(index(x, y, CORNER), index(x, y, VERTICAL), index(x, y, HORIZONTAL), 10 + dy * dy);
                }
            }
        }

        private int index(int x, int y, int lane) {
            return x + width * (y + height * lane);
        }

        private void connect(int e, int a, int b, int w) {
            edgeA[e] = a;
            edgeB[e] = b;
            weight[e] = w;
            incident[a][degree[a]++] = e;
            incident[b][degree[b]++] = e;
        }

        /** Routes one connection; false if no output column is reachable. */
        boolean route(Bus bus, int connection) {
            Arrays.fill(visited, false);
            Arrays.fill(cost, UNREACHABLE);
            Arrays.fill(isStart, false);

            // Min-heap keyed on (cost, vertex), packed into one long
            PriorityQueue<Long> queue = new PriorityQueue<>();
            int[] targets = new int[width];
            int targetCount = 0;
            for (int x = 0; x < width; x++) {
                if (bus.inputs(x).contains(connection)) {
                    int s = index(x, 0, VERTICAL);
                    isStart[s] = true;
                    queue.add((long) s);
                }
                if (bus.outputs(x).contains(connection))
                    targets[targetCount++] = index(x, height - 1, VERTICAL);
            }

            while (!queue.isEmpty()) {
                long top = queue.poll();
                int v = (int) top;
                int c = (int) (top >>> 32);
                if (visited[v])
                    continue;
                visited[v] = true;
                cost[v] = c;
                for (int i = 0; i < degree[v]; i++) {
                    int e = incident[v][i];
                    if (assigned[e] != 0)
                        continue;
                    int u = edgeA[e] == v ? edgeB[e] : edgeA[e];
                    if (visited[u])
                        continue;
                    queue.add(((long) (c + weight[e]) << 32) | u);
                }
            }

            int best = UNREACHABLE;
            int cur = -1;
            for (int i = 0; i < targetCount; i++) {
                if (cost[targets[i]] < best) {
                    best = cost[targets[i]];
                    cur = targets[i];
                }
            }
            if (cur < 0)
                return false;

            // Walk back along edges whose cost difference matches their weight
            while (!isStart[cur]) {
                int prev = -1;
                for (int i = 0; i < degree[cur]; i++) {
                    int e = incident[cur][i];
                    if (assigned[e] != 0)
                        continue;
                    int u = edgeA[e] == cur ? edgeB[e] : edgeA[e];
                    if (cost[u] + weight[e] == cost[cur]) {
                        assigned[e] = connection;
                        prev = u;
                        break;
                    }
                }
                if (prev < 0)
                    throw new IllegalStateException("Broken shortest-path trace for connection " + connection);
                cur = prev;
            }

            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int vertical = index(x, y, VERTICAL);
                    int horizontal = index(x, y, HORIZONTAL);
                    if (assigned[vertical] != 0)
                        weight[horizontal] = CROSSING_PENALTY;
                    if (assigned[horizontal] != 0)
                        weight[vertical] = CROSSING_PENALTY;
                }
            }
            return true;
        }

        private boolean isAssigned(int x, int y, int lane) {
            return assigned[index(x, y, lane)] != 0;
        }

        char[][] raster() {
            char[][] out = new char[height][width];
            for (int y = 0; y < height; y++) {
                Arrays.fill(out[y], ' ');
                for (int x = 0; x < width; x++) {
                    boolean vertical = isAssigned(x, y, VERTICAL);
                    boolean horizontal = isAssigned(x, y, HORIZONTAL);
                    if (horizontal)
                        out[y][x] = '─';
                    if (vertical)
                        out[y][x] = '│';
                    if (isAssigned(x, y, CORNER)) {
                        if (vertical)
                            out[y][x] = horizontal ? '┌' : '┐';
                        else
                            out[y][x] = horizontal ? '└' : '┘';
                    }
                }
            }
            return out;
        }
    }
}
