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

import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Grades of expression nodes, keyed by node uid. Filled by
 * {@link ExprGradeAnalysis}; nodes that were never labeled have no grade.
 *
 * @author The tla-symbolic-checker Authors
 */
public class ExprGradeStore {
  private final Map<Long, ExprGrade> grades = Maps.newHashMap();

  public void put(TlaEx ex, ExprGrade grade) {
    grades.put(ex.getUid(), grade);
  }

  /** @return the grade of the node, or null if it was not labeled */
  public ExprGrade get(TlaEx ex) {
    return grades.get(ex.getUid());
  }

  public boolean isConstant(TlaEx ex) {
    return grades.get(ex.getUid()) == ExprGrade.CONSTANT;
  }

  public int size() {
    return grades.size();
  }
}
