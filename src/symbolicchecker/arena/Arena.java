/*
 * Copyright 2010 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package symbolicchecker.arena;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import symbolicchecker.ir.CellT;
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.TlaEx;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An append-only store of cells and of the relations between them: set
 * membership ("has"), function domain and co-domain.
 * <p>
 * An {@code Arena} value is an immutable view of a lineage: it remembers how
 * many cells and edges existed when it was produced, and every query answers
 * relative to that point, so older views stay valid while the lineage grows.
 * Only the newest view (the tip) may be extended. {@link #discardFuture()}
 * cuts a lineage back to an older view; identities allocated after that view
 * are then handed out again.
 * <p>
 * Not thread-safe. A lineage belongs to a single execution context.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class Arena {
  public static final int FALSE_CELL_ID = 0;
  public static final int TRUE_CELL_ID = 1;

  private final Lineage lineage;
  private final int cellCount;
  private final int edgeCount;

  private Arena(Lineage lineage, int cellCount, int edgeCount) {
    this.lineage = lineage;
    this.cellCount = cellCount;
    this.edgeCount = edgeCount;
  }

  /** Creates a lineage holding the predefined cells FALSE and TRUE. */
  public static Arena create() {
    return new Arena(new Lineage(), 0, 0)
        .appendCell(CellT.bool())
        .appendCell(CellT.bool());
  }

  /** Allocates a new cell; it becomes the {@link #topCell()} of the result. */
  public Arena appendCell(CellT type) {
    checkTip();
    ArenaCell cell = new ArenaCell(cellCount, type);
    lineage.cells.add(cell);
    return new Arena(lineage, cellCount + 1, edgeCount);
  }

  /** @return the most recently allocated cell */
  public ArenaCell topCell() {
    return lineage.cells.get(cellCount - 1);
  }

  public Arena appendHas(ArenaCell container, ArenaCell... elems) {
    return appendHas(container, Arrays.asList(elems));
  }

  /**
   * Records that {@code container} may contain each of {@code elems}, in the
   * given order.
   *
   * @throws UnknownCellException if a cell was not allocated in this lineage
   * @throws IllegalArgumentException if an element is already recorded for
   *         the container
   */
  public Arena appendHas(ArenaCell container, List<ArenaCell> elems) {
    checkKnown(container);
    Set<Integer> seen = Sets.newHashSet();
    for (ArenaCell elem : getHas(container)) {
      seen.add(elem.getId());
    }
    for (ArenaCell elem : elems) {
      checkKnown(elem);
      Preconditions.checkArgument(seen.add(elem.getId()),
          "%s already has %s", container, elem);
    }
    checkTip();
    int nextEdge = edgeCount;
    for (ArenaCell elem : elems) {
      lineage.addEdge(new Edge(EdgeKind.HAS, container.getId(), elem.getId()));
      nextEdge++;
    }
    return new Arena(lineage, cellCount, nextEdge);
  }

  /** @return the potential elements of {@code container}, in append order */
  public ImmutableList<ArenaCell> getHas(ArenaCell container) {
    checkKnown(container);
    ImmutableList.Builder<ArenaCell> result = ImmutableList.builder();
    for (int edgeIndex : lineage.hasIndex.get(container.getId())) {
      if (edgeIndex >= edgeCount) {
        break;
      }
      result.add(lineage.cells.get(lineage.edges.get(edgeIndex).to));
    }
    return result.build();
  }

  /** Sets the domain of a function cell; may be done once per function. */
  public Arena setDom(ArenaCell fun, ArenaCell dom) {
    return setSingleEdge(EdgeKind.DOM, fun, dom);
  }

  /** Sets the co-domain of a function cell; may be done once per function. */
  public Arena setCdm(ArenaCell fun, ArenaCell cdm) {
    return setSingleEdge(EdgeKind.CDM, fun, cdm);
  }

  public boolean hasDom(ArenaCell fun) {
    return findSingleEdge(EdgeKind.DOM, fun) != null;
  }

  /** @throws IllegalStateException if the domain was never set */
  public ArenaCell getDom(ArenaCell fun) {
    ArenaCell dom = findSingleEdge(EdgeKind.DOM, fun);
    Preconditions.checkState(dom != null, "%s has no domain", fun);
    return dom;
  }

  /** @throws IllegalStateException if the co-domain was never set */
  public ArenaCell getCdm(ArenaCell fun) {
    ArenaCell cdm = findSingleEdge(EdgeKind.CDM, fun);
    Preconditions.checkState(cdm != null, "%s has no co-domain", fun);
    return cdm;
  }

  public ArenaCell cellFalse() {
    return lineage.cells.get(FALSE_CELL_ID);
  }

  public ArenaCell cellTrue() {
    return lineage.cells.get(TRUE_CELL_ID);
  }

  /** @throws UnknownCellException if no such cell exists in this view */
  public ArenaCell findCellById(int id) {
    if (id < 0 || id >= cellCount) {
      throw new UnknownCellException(
          String.format("cell %d is not in an arena of %d cells", id,
              cellCount));
    }
    return lineage.cells.get(id);
  }

  /**
   * @return the cell a cell reference names
   * @throws UnknownCellException if {@code ex} is not a reference to a cell of
   *         this view
   */
  public ArenaCell findCellByNameEx(TlaEx ex) {
    if (!ArenaCell.isCellRef(ex)) {
      throw new UnknownCellException("not a cell reference: " + ex);
    }
    return findCellById(ArenaCell.idFromName(((NameEx) ex).getName()));
  }

  /** @return the number of cells in this view, also the next identity */
  public int cellCount() {
    return cellCount;
  }

  /** @return the number of relation edges in this view */
  public int edgeCount() {
    return edgeCount;
  }

  /** @return true if nothing was appended to the lineage after this view */
  public boolean isTip() {
    return lineage.cells.size() == cellCount
        && lineage.edges.size() == edgeCount;
  }

  /** @return true if both views belong to the same lineage */
  public boolean sameLineage(Arena other) {
    return lineage == other.lineage;
  }

  /**
   * Cuts the lineage back to this view. Every view produced after this one
   * becomes invalid, and cell identities above {@link #cellCount()} are
   * allocated again by later appends.
   */
  public void discardFuture() {
    lineage.truncate(cellCount, edgeCount);
  }

  @Override
  public String toString() {
    return String.format("Arena(cells=%d, edges=%d)", cellCount, edgeCount);
  }

  private Arena setSingleEdge(EdgeKind kind, ArenaCell fun, ArenaCell target) {
    checkKnown(fun);
    checkKnown(target);
    Preconditions.checkArgument(findSingleEdge(kind, fun) == null,
        "%s of %s is already set", kind, fun);
    checkTip();
    lineage.addEdge(new Edge(kind, fun.getId(), target.getId()));
    return new Arena(lineage, cellCount, edgeCount + 1);
  }

  private ArenaCell findSingleEdge(EdgeKind kind, ArenaCell fun) {
    checkKnown(fun);
    Map<Integer, Integer> index = lineage.singleIndex(kind);
    Integer edgeIndex = index.get(fun.getId());
    if (edgeIndex == null || edgeIndex >= edgeCount) {
      return null;
    }
    return lineage.cells.get(lineage.edges.get(edgeIndex).to);
  }

  private void checkKnown(ArenaCell cell) {
    if (cell.getId() < 0 || cell.getId() >= cellCount
        || !lineage.cells.get(cell.getId()).equals(cell)) {
      throw new UnknownCellException(
          String.format("%s (%s) was not allocated in %s", cell,
              cell.getType(), this));
    }
  }

  private void checkTip() {
    Preconditions.checkState(isTip(),
        "%s is not the newest view of its arena (%d cells, %d edges)", this,
        lineage.cells.size(), lineage.edges.size());
  }

  private enum EdgeKind {
    HAS, DOM, CDM
  }

  private static final class Edge {
    final EdgeKind kind;
    final int from;
    final int to;

    Edge(EdgeKind kind, int from, int to) {
      this.kind = kind;
      this.from = from;
      this.to = to;
    }
  }

  /** The shared log behind all views of one arena. */
  private static final class Lineage {
    final List<ArenaCell> cells = Lists.newArrayList();
    final List<Edge> edges = Lists.newArrayList();
    // container id -> indices into edges, ascending
    final ListMultimap<Integer, Integer> hasIndex = ArrayListMultimap.create();
    final Map<Integer, Integer> domIndex = Maps.newHashMap();
    final Map<Integer, Integer> cdmIndex = Maps.newHashMap();

    void addEdge(Edge edge) {
      int index = edges.size();
      edges.add(edge);
      switch (edge.kind) {
        case HAS:
          hasIndex.put(edge.from, index);
          break;
        default:
          singleIndex(edge.kind).put(edge.from, index);
          break;
      }
    }

    Map<Integer, Integer> singleIndex(EdgeKind kind) {
      Preconditions.checkArgument(kind != EdgeKind.HAS);
      return kind == EdgeKind.DOM ? domIndex : cdmIndex;
    }

    void truncate(int cellCount, int edgeCount) {
      Preconditions.checkArgument(
          cellCount <= cells.size() && edgeCount <= edges.size(),
          "cannot extend an arena by truncation");
      while (edges.size() > edgeCount) {
        Edge edge = edges.remove(edges.size() - 1);
        if (edge.kind == EdgeKind.HAS) {
          List<Integer> indices = hasIndex.get(edge.from);
          indices.remove(indices.size() - 1);
        } else {
          singleIndex(edge.kind).remove(edge.from);
        }
      }
      while (cells.size() > cellCount) {
        cells.remove(cells.size() - 1);
      }
    }
  }
}
