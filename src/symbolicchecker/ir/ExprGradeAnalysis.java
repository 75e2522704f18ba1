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

package symbolicchecker.ir;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * Labels every node of an expression with its {@link ExprGrade}. A name bound
 * by a set filter is not free in the filter, so {@code {x \in {1, 2}: x = 1}}
 * is constant while its predicate is not.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class ExprGradeAnalysis {
  private final ExprGradeStore store;

  public ExprGradeAnalysis(ExprGradeStore store) {
    this.store = store;
  }

  /** Labels {@code ex} and all its subexpressions, returning the root grade. */
  public ExprGrade labelWithGrades(TlaEx ex) {
    freeNames(ex);
    return store.get(ex);
  }

  private Set<String> freeNames(TlaEx ex) {
    Set<String> free = ex.accept(new TlaEx.Visitor<Set<String>>() {
      @Override
      public Set<String> visitName(NameEx name) {
        return ImmutableSet.of(name.getName());
      }

      @Override
      public Set<String> visitVal(ValEx val) {
        return ImmutableSet.of();
      }

      @Override
      public Set<String> visitOper(OperEx oper) {
        Set<String> result = Sets.newHashSet();
        if (oper.getOper() == TlaOper.FILTER) {
          String bound = ((NameEx) oper.getArg(0)).getName();
          result.addAll(freeNames(oper.getArg(1)));
          Set<String> inPred = Sets.newHashSet(freeNames(oper.getArg(2)));
          inPred.remove(bound);
          result.addAll(inPred);
        } else {
          for (TlaEx arg : oper.getArgs()) {
            result.addAll(freeNames(arg));
          }
        }
        return result;
      }
    });
    store.put(ex, gradeOf(free));
    return free;
  }

  private static ExprGrade gradeOf(Set<String> free) {
    ExprGrade grade = ExprGrade.CONSTANT;
    for (String name : free) {
      grade = grade.join(
          name.endsWith("'") ? ExprGrade.ACTION : ExprGrade.STATE);
    }
    return grade;
  }
}
