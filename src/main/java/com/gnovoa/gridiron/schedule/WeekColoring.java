package com.gnovoa.gridiron.schedule;

import com.gnovoa.gridiron.sim.RandomSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Assigns games to weeks by proper edge colouring of the opponent graph.
 *
 * <p>Teams are vertices, games are edges and weeks are colours. The opponent graph must be simple
 * (no repeated pairing). Misra-Gries colours any simple graph of maximum degree D with D + 1
 * colours, so a graph where every team has D games always fits into D + 1 weeks with exactly one
 * bye each. Byes are then evened out with Kempe-chain swaps.
 */
final class WeekColoring {

    /** An undirected game between vertex indices {@code a} and {@code b}. */
    record Edge(int a, int b) {}

    private final int vertices;
    private final int colors;
    /** at[v][c] = neighbour joined to v by an edge of colour c, or -1. */
    private final int[][] at;
    /** colorOf[u][v] = colour of edge uv, -1 when uncoloured, -2 when no such edge. */
    private final int[][] colorOf;

    private WeekColoring(int vertices, int colors) {
        this.vertices = vertices;
        this.colors = colors;
        this.at = new int[vertices][colors];
        this.colorOf = new int[vertices][vertices];
        for (int[] row : at) Arrays.fill(row, -1);
        for (int[] row : colorOf) Arrays.fill(row, -2);
    }

    /**
     * Colours {@code edges} with {@code colors} colours, processing them in a random order.
     *
     * @return colour per edge, index-aligned with {@code edges}
     * @throws IllegalArgumentException if the graph is not simple or its degree exceeds colors - 1
     */
    static int[] color(int vertices, List<Edge> edges, int colors, RandomSource rnd) {
        WeekColoring wc = new WeekColoring(vertices, colors);
        int[] degree = new int[vertices];
        for (Edge e : edges) {
            if (e.a() == e.b()) throw new IllegalArgumentException("Self pairing at vertex " + e.a());
            if (wc.colorOf[e.a()][e.b()] != -2) {
                throw new IllegalArgumentException("Repeated pairing " + e.a() + "-" + e.b());
            }
            wc.colorOf[e.a()][e.b()] = -1;
            wc.colorOf[e.b()][e.a()] = -1;
            degree[e.a()]++;
            degree[e.b()]++;
        }
        for (int d : degree) {
            if (d >= colors) throw new IllegalArgumentException("Degree " + d + " needs more than " + colors + " colours");
        }

        List<Edge> order = new ArrayList<>(edges);
        rnd.shuffle(order);
        for (Edge e : order) wc.colorEdge(e.a(), e.b());

        int[] out = new int[edges.size()];
        for (int i = 0; i < edges.size(); i++) out[i] = wc.colorOf[edges.get(i).a()][edges.get(i).b()];
        return out;
    }

    /**
     * Kempe-chain rebalancing of the colours each vertex is missing.
     *
     * <p>Only meaningful when every vertex misses exactly one colour. Moves two byes at a time from
     * the busiest bye colour to the emptiest until the busiest one has at most {@code maxMissing}
     * vertices, or until their counts differ by at most two, which is the most even spread there is.
     *
     * @return rebalanced colour per edge
     */
    static int[] balanceMissing(int vertices, List<Edge> edges, int[] edgeColors, int colors, int maxMissing) {
        WeekColoring wc = new WeekColoring(vertices, colors);
        for (int i = 0; i < edges.size(); i++) {
            Edge e = edges.get(i);
            wc.colorOf[e.a()][e.b()] = -1;
            wc.colorOf[e.b()][e.a()] = -1;
            wc.set(e.a(), e.b(), edgeColors[i]);
        }

        for (int guard = 0; guard < vertices * colors; guard++) {
            int[] missing = wc.missingCounts();
            int x = 0;
            int y = 0;
            for (int c = 1; c < colors; c++) {
                if (missing[c] > missing[x]) x = c;
                if (missing[c] < missing[y]) y = c;
            }
            if (missing[x] <= maxMissing || missing[x] - missing[y] <= 2) break;
            if (!wc.moveTwoMissing(x, y)) break;
        }

        int[] out = new int[edges.size()];
        for (int i = 0; i < edges.size(); i++) out[i] = wc.colorOf[edges.get(i).a()][edges.get(i).b()];
        return out;
    }

    /**
     * Smallest possible size of the busiest bye colour when each of {@code vertices} vertices misses
     * exactly one of {@code colors} colours.
     *
     * <p>A colour class is a matching, so the vertices missing it number {@code vertices} minus an
     * even count and share the parity of {@code vertices}.
     */
    static int lowestReachableMaxMissing(int vertices, int colors) {
        int load = (vertices + colors - 1) / colors;
        if ((load - vertices) % 2 != 0) load++;
        return load;
    }

    private void colorEdge(int u, int v) {
        List<Integer> fan = buildFan(u, v);
        int last = fan.get(fan.size() - 1);
        int c = freeColor(u);
        int d = freeColor(last);

        invertPath(u, c, d);

        int w = -1;
        for (int i = 0; i < fan.size(); i++) {
            int f = fan.get(i);
            if (isFree(f, d) && isFan(u, fan, i)) {
                w = i;
                break;
            }
        }
        if (w < 0) throw new IllegalStateException("No rotatable fan vertex for edge " + u + "-" + v);

        for (int i = 0; i < w; i++) {
            int next = fan.get(i + 1);
            int shifted = colorOf[u][next];
            unset(u, next);
            set(u, fan.get(i), shifted);
        }
        set(u, fan.get(w), d);
    }

    private List<Integer> buildFan(int u, int v) {
        List<Integer> fan = new ArrayList<>();
        boolean[] inFan = new boolean[vertices];
        fan.add(v);
        inFan[v] = true;

        boolean grew = true;
        while (grew) {
            grew = false;
            int last = fan.get(fan.size() - 1);
            for (int c = 0; c < colors; c++) {
                if (!isFree(last, c)) continue;
                int w = at[u][c];
                if (w >= 0 && !inFan[w]) {
                    fan.add(w);
                    inFan[w] = true;
                    grew = true;
                    break;
                }
            }
        }
        return fan;
    }

    /** fan[0..end] is a fan of u: fan[0] uncoloured, each later edge's colour free on its predecessor. */
    private boolean isFan(int u, List<Integer> fan, int end) {
        if (colorOf[u][fan.get(0)] != -1) return false;
        for (int i = 1; i <= end; i++) {
            int col = colorOf[u][fan.get(i)];
            if (col < 0 || !isFree(fan.get(i - 1), col)) return false;
        }
        return true;
    }

    /** Swaps c and d along the maximal path from {@code start} alternating d, c, d, ... */
    private void invertPath(int start, int c, int d) {
        if (c == d) return;
        List<int[]> path = new ArrayList<>();
        int x = start;
        int col = d;
        while (at[x][col] >= 0) {
            int y = at[x][col];
            path.add(new int[] {x, y, col});
            x = y;
            col = (col == d) ? c : d;
            if (x == start) break;
        }
        for (int[] e : path) unset(e[0], e[1]);
        for (int[] e : path) set(e[0], e[1], e[2] == d ? c : d);
    }

    private int[] missingCounts() {
        int[] counts = new int[colors];
        for (int v = 0; v < vertices; v++) {
            for (int c = 0; c < colors; c++) {
                if (isFree(v, c)) counts[c]++;
            }
        }
        return counts;
    }

    /** Finds an x/y chain joining two vertices that both miss x, and swaps it. */
    private boolean moveTwoMissing(int x, int y) {
        for (int v = 0; v < vertices; v++) {
            if (!isFree(v, x) || isFree(v, y)) continue;

            List<int[]> chain = new ArrayList<>();
            int cur = v;
            int col = y;
            while (at[cur][col] >= 0) {
                int next = at[cur][col];
                chain.add(new int[] {cur, next, col});
                cur = next;
                col = (col == y) ? x : y;
            }
            if (chain.get(chain.size() - 1)[2] != y) continue;

            for (int[] e : chain) unset(e[0], e[1]);
            for (int[] e : chain) set(e[0], e[1], e[2] == y ? x : y);
            return true;
        }
        return false;
    }

    private int freeColor(int v) {
        for (int c = 0; c < colors; c++) {
            if (isFree(v, c)) return c;
        }
        throw new IllegalStateException("Vertex " + v + " has no free colour");
    }

    private boolean isFree(int v, int c) {
        return at[v][c] < 0;
    }

    private void set(int a, int b, int c) {
        at[a][c] = b;
        at[b][c] = a;
        colorOf[a][b] = c;
        colorOf[b][a] = c;
    }

    private void unset(int a, int b) {
        int c = colorOf[a][b];
        if (c < 0) return;
        at[a][c] = -1;
        at[b][c] = -1;
        colorOf[a][b] = -1;
        colorOf[b][a] = -1;
    }
}
