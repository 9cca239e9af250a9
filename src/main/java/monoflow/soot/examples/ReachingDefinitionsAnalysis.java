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
package monoflow.soot.examples;

import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import monoflow.DataFlowSolution;
import monoflow.ForwardFlowAnalysis;
import monoflow.Meets;
import monoflow.soot.SootFlowGraphs;
import soot.Body;
import soot.Local;
import soot.Unit;
import soot.Value;
import soot.ValueBox;
import soot.toolkits.graph.BriefUnitGraph;
import soot.toolkits.graph.DirectedGraph;

/**
 * A reaching definitions analysis of the locals of a Jimple body.
 *
 * <p>The data items are the units which define a local. A definition reaches
 * a program point if there is a path from the definition to that point on
 * which the local is not defined again. A defining unit generates itself and
 * cuts every other definition of the same local.</p>
 *
 */
public class ReachingDefinitionsAnalysis extends ForwardFlowAnalysis<Unit, Unit> {

	// The control flow graph of the analysed body
	private final DirectedGraph<Unit> graph;

	// All units defining each local, computed once up-front
	private final Map<Local, List<Unit>> definitions;

	/**
	 * Constructs a reaching definitions analysis over the unexceptional
	 * control flow graph of the given body.
	 */
	public ReachingDefinitionsAnalysis(Body body) {
		this(new BriefUnitGraph(body));
	}

	public ReachingDefinitionsAnalysis(DirectedGraph<Unit> graph) {
		super();
		this.graph = graph;
		this.definitions = new HashMap<Local, List<Unit>>();
		for (Unit unit : graph) {
			for (Local local : definedLocals(unit)) {
				if (definitions.containsKey(local) == false) {
					definitions.put(local, new LinkedList<Unit>());
				}
				definitions.get(local).add(unit);
			}
		}
	}

	/**
	 * Computes the definitions reaching the entry (IN) and exit (OUT) of every
	 * unit. No definition reaches the heads of the graph.
	 */
	public DataFlowSolution<Unit, Set<Unit>> reachingDefinitions() {
		return analyzeSolution(SootFlowGraphs.nodes(graph));
	}

	/**
	 * Returns the units defining the given local.
	 */
	public List<Unit> getDefinitions(Local local) {
		List<Unit> units = definitions.get(local);
		return units == null ? new LinkedList<Unit>() : units;
	}

	@Override
	protected List<Unit> predecessors(Unit unit) {
		return graph.getPredsOf(unit);
	}

	// A definition reaches if it reaches along any path
	@Override
	public Set<Unit> meet(Set<Unit> op1, Set<Unit> op2) {
		return Meets.union(op1, op2);
	}

	@Override
	public void updateGen(Unit unit, Set<Unit> gen) {
		if (definedLocals(unit).isEmpty() == false) {
			gen.add(unit);
		}
	}

	@Override
	public void updateCut(Unit unit, Set<Unit> cut) {
		for (Local local : definedLocals(unit)) {
			for (Unit definition : definitions.get(local)) {
				if (definition != unit) {
					cut.add(definition);
				}
			}
		}
	}

	// Returns the locals written by a unit
	private static List<Local> definedLocals(Unit unit) {
		List<Local> locals = new LinkedList<Local>();
		for (ValueBox box : unit.getDefBoxes()) {
			Value value = box.getValue();
			if (value instanceof Local) {
				locals.add((Local) value);
			}
		}
		return locals;
	}

}
