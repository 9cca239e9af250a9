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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Set;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import monoflow.DataFlowSolution;
import soot.Local;
import soot.Unit;
import soot.jimple.IntConstant;
import soot.jimple.Jimple;
import soot.jimple.JimpleBody;

public class ReachingDefinitionsAnalysisTest {

	@Test
	public void definitionsMergeAfterBranch() {
		// s1: x = 1; s2: if x > 0 goto s4; s3: x = 2; s4: return x
		JimpleBody body = JimpleBodies.newBody("branch");
		Local x = JimpleBodies.newIntLocal(body, "x");
		Unit s1 = Jimple.v().newAssignStmt(x, IntConstant.v(1));
		Unit s4 = Jimple.v().newReturnStmt(x);
		Unit s2 = Jimple.v().newIfStmt(Jimple.v().newGtExpr(x, IntConstant.v(0)), s4);
		Unit s3 = Jimple.v().newAssignStmt(x, IntConstant.v(2));
		body.getUnits().add(s1);
		body.getUnits().add(s2);
		body.getUnits().add(s3);
		body.getUnits().add(s4);

		ReachingDefinitionsAnalysis analysis = new ReachingDefinitionsAnalysis(body);
		DataFlowSolution<Unit, Set<Unit>> reaching = analysis.reachingDefinitions();

		assertEquals(Arrays.asList(s1, s3), analysis.getDefinitions(x));
		assertTrue(reaching.getValueBefore(s1).isEmpty());
		assertEquals(ImmutableSet.of(s1), reaching.getValueAfter(s1));
		assertEquals(ImmutableSet.of(s1), reaching.getValueAfter(s2));
		assertEquals(ImmutableSet.of(s3), reaching.getValueAfter(s3));
		assertEquals(ImmutableSet.of(s1, s3), reaching.getValueBefore(s4));
	}

	@Test
	public void redefinitionInLoopReachesHead() {
		// s1: i = 0; s2: if i > 10 goto s5; s3: i = i + 1; s4: goto s2; s5: return i
		JimpleBody body = JimpleBodies.newBody("loop");
		Local i = JimpleBodies.newIntLocal(body, "i");
		Unit s1 = Jimple.v().newAssignStmt(i, IntConstant.v(0));
		Unit s5 = Jimple.v().newReturnStmt(i);
		Unit s2 = Jimple.v().newIfStmt(Jimple.v().newGtExpr(i, IntConstant.v(10)), s5);
		Unit s3 = Jimple.v().newAssignStmt(i, Jimple.v().newAddExpr(i, IntConstant.v(1)));
		Unit s4 = Jimple.v().newGotoStmt(s2);
		body.getUnits().add(s1);
		body.getUnits().add(s2);
		body.getUnits().add(s3);
		body.getUnits().add(s4);
		body.getUnits().add(s5);

		DataFlowSolution<Unit, Set<Unit>> reaching = new ReachingDefinitionsAnalysis(body).reachingDefinitions();

		assertEquals(ImmutableSet.of(s1, s3), reaching.getValueBefore(s2));
		assertEquals(ImmutableSet.of(s3), reaching.getValueAfter(s3));
		assertEquals(ImmutableSet.of(s1, s3), reaching.getValueBefore(s5));
	}
}
