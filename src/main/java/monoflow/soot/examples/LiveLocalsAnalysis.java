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

import java.util.List;
import java.util.Set;

import monoflow.BackwardFlowAnalysis;
import monoflow.DataFlowSolution;
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
 * A live variables analysis of the locals of a Jimple body.
 *
 * <p>A local is live at a program point if its current value may be read
 * along some path from that point before it is overwritten. A statement
 * generates the locals it uses and cuts the locals it defines.</p>
 *
 */
public class LiveLocalsAnalysis extends BackwardFlowAnalysis<Unit, Local> {

	// The control flow graph of the analysed body
	private final DirectedGraph<Unit> graph;

	/**
	 * Constructs a live locals analysis over the unexceptional control
	 * flow graph of the given body.
	 */
	public LiveLocalsAnalysis(Body body) {
		this(new BriefUnitGraph(body));
	}

	public LiveLocalsAnalysis(DirectedGraph<Unit> graph) {
		super();
		this.graph = graph;
	}

	/**
	 * Computes the live locals before (IN) and after (OUT) every unit. Nothing
	 * is live after the tails of the graph.
	 */
	public DataFlowSolution<Unit, Set<Local>> liveLocals() {
		return analyzeSolution(SootFlowGraphs.nodes(graph));
	}

	@Override
	protected List<Unit> successors(Unit unit) {
		return graph.getSuccsOf(unit);
	}

	// A local is live if it is live along any path
	@Override
	public Set<Local> meet(Set<Local> op1, Set<Local> op2) {
		return Meets.union(op1, op2);
	}

	@Override
	public void updateGen(Unit unit, Set<Local> gen) {
		for (ValueBox box : unit.getUseBoxes()) {
			Value value = box.getValue();
			if (value instanceof Local) {
				gen.add((Local) value);
			}
		}
	}

	@Override
	public void updateCut(Unit unit, Set<Local> cut) {
		for (ValueBox box : unit.getDefBoxes()) {
			Value value = box.getValue();
			if (value instanceof Local) {
				cut.add((Local) value);
			}
		}
	}

}
