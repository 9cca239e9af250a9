/**
 * Copyright (C) 2013 Rohan Padhye
 * 
 * This library is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as 
 * published by the Free Software Foundation, either version 2.1 of the 
 * License, or (at your option) any later version.
 * 
 * This library is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 * 
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 * 
 */
package monoflow;

import static monoflow.FlowFixtures.graph;
import static monoflow.FlowFixtures.set;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

import monoflow.FlowFixtures.TableForwardAnalysis;
import monoflow.FlowFixtures.Tables;
import soot.toolkits.graph.HashMutableDirectedGraph;

public class ForwardFlowAnalysisTest {

	private static final List<String> CHAIN = Arrays.asList("A", "B", "C");

	@Test
	public void linearReachingDefinitions() {
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "B", "C"),
				new Tables(false).gen("A", "d1"));

		DataFlowSolution<String, Set<String>> solution = analysis.analyzeSolution(CHAIN, "A", set());

		assertEquals(set(), solution.getValueBefore("A"));
		assertEquals(set("d1"), solution.getValueAfter("A"));
		assertEquals(set("d1"), solution.getValueBefore("B"));
		assertEquals(set("d1"), solution.getValueAfter("B"));
		assertEquals(set("d1"), solution.getValueBefore("C"));
		assertEquals(set("d1"), solution.getValueAfter("C"));
		assertEquals(set("d1"), analysis.analyze(CHAIN, "A", "C", set()));
	}

	@Test
	public void analyzeFullReturnsOutOfEveryNode() {
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "B", "C"),
				new Tables(false).gen("A", "d1").gen("B", "d2").cut("C", "d1"));

		Map<String, Set<String>> out = analysis.analyzeFull(CHAIN, "A", "C", set());

		assertEquals(CHAIN, Arrays.asList(out.keySet().toArray()));
		assertEquals(set("d1"), out.get("A"));
		assertEquals(set("d1", "d2"), out.get("B"));
		assertEquals(set("d2"), out.get("C"));
	}

	@Test
	public void nodeWithoutPredecessorsHasEmptyIn() {
		// X is disconnected from the rest and B's OUT is non-empty.
		HashMutableDirectedGraph<String> graph = graph("A", "B");
		graph.addNode("X");
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph,
				new Tables(false).gen("B", "d1").gen("X", "d2"));

		DataFlowSolution<String, Set<String>> solution =
				analysis.analyzeSolution(Arrays.asList("A", "B", "X"), "A", set());

		assertEquals(set(), solution.getValueBefore("X"));
		assertEquals(set("d2"), solution.getValueAfter("X"));
		assertEquals(set("d1"), solution.getValueAfter("B"));
	}

	@Test
	public void intersectionMeetAtDiamondJoin() {
		// Available expressions: D joins B and C.
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "A", "C", "B", "D", "C", "D"),
				new Tables(true).gen("B", "e1", "e2").gen("C", "e2"));
		List<String> nodes = Arrays.asList("A", "B", "C", "D");

		DataFlowSolution<String, Set<String>> solution = analysis.analyzeSolution(nodes, "A", set());

		assertEquals(set("e1", "e2"), solution.getValueAfter("B"));
		assertEquals(set("e2"), solution.getValueAfter("C"));
		assertEquals(set("e2"), solution.getValueBefore("D"));
		assertEquals(set("e2"), analysis.analyze(nodes, "A", "D", set()));
	}

	@Test
	public void loopReachesFixpoint() {
		// A -> B -> C -> B, with a redefinition of d1 in C.
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "B", "C", "C", "B"),
				new Tables(false).gen("A", "d1").gen("C", "d3").cut("C", "d1"));

		DataFlowSolution<String, Set<String>> solution = analysis.analyzeSolution(CHAIN, "A", set());

		assertEquals(set("d1", "d3"), solution.getValueBefore("B"));
		assertEquals(set("d3"), solution.getValueAfter("C"));
	}

	@Test
	public void seedIsKeptAtNodeWithPredecessors() {
		// A is the loop head of A -> B -> A; the boundary value must not be replaced by OUT(B).
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "B", "A"),
				new Tables(false).cut("B", "s"));

		DataFlowSolution<String, Set<String>> solution =
				analysis.analyzeSolution(Arrays.asList("A", "B"), "A", set("s"));

		assertEquals(set("s"), solution.getValueBefore("A"));
		assertEquals(set("s"), solution.getValueAfter("A"));
		assertEquals(set(), solution.getValueAfter("B"));
	}

	@Test
	public void repeatedRunsGiveIdenticalResults() {
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "A", "C", "B", "D", "C", "D"),
				new Tables(false).gen("B", "d1").gen("C", "d2").cut("D", "d1"));
		List<String> nodes = Arrays.asList("A", "B", "C", "D");

		Map<String, Set<String>> first = analysis.analyzeFull(nodes, "A", "D", set("d0"));
		int rounds = analysis.getRounds();
		Map<String, Set<String>> second = analysis.analyzeFull(nodes, "A", "D", set("d0"));

		assertEquals(first, second);
		assertEquals(rounds, analysis.getRounds());
	}

	@Test
	public void runsDoNotShareState() {
		HashMutableDirectedGraph<String> graph = graph("A", "B", "B", "C", "X", "Y");
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph, new Tables(false).gen("A", "d1"));

		analysis.analyzeFull(CHAIN, "A", "C", set("seed"));
		Map<String, Set<String>> out = analysis.analyzeFull(Arrays.asList("X", "Y"), "X", "Y", set());

		assertEquals(Arrays.asList("X", "Y"), Arrays.asList(out.keySet().toArray()));
		assertEquals(set(), out.get("Y"));
	}

	@Test
	public void resultsAreSnapshots() {
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B"), new Tables(false).gen("A", "d1"));

		Set<String> result = analysis.analyze(Arrays.asList("A", "B"), "A", "B", set());
		try {
			result.add("other");
			fail("Result should be unmodifiable");
		} catch (UnsupportedOperationException e) {
			assertFalse(result.contains("other"));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownInitialNodeIsRejected() {
		new TableForwardAnalysis(graph("A", "B"), new Tables(false)).analyze(Arrays.asList("A", "B"), "Z", "B", set());
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownEndNodeIsRejected() {
		new TableForwardAnalysis(graph("A", "B"), new Tables(false)).analyzeFull(Arrays.asList("A", "B"), "A", "Z", set());
	}

	@Test
	public void roundLimitStopsTheRun() {
		TableForwardAnalysis analysis = new TableForwardAnalysis(graph("A", "B", "B", "C"),
				new Tables(false).gen("A", "d1"));
		analysis.maxRounds = 2;

		try {
			analysis.analyze(CHAIN, "A", "C", set());
			fail("Expected the round limit to be hit");
		} catch (NonConvergenceException e) {
			assertEquals(2, e.getRounds());
			assertEquals(2, e.getMaxRounds());
		}

		analysis.maxRounds = 10;
		assertTrue(analysis.analyze(CHAIN, "A", "C", set()).contains("d1"));
	}
}
