/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.timewarp;

/**
 * What the run loop does after a statement: continue, end, jump to an index, or stop on an error
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public final class StepResult {
	/** Result types */
	public static enum Type {
		CONTINUE,
		END,
		JUMP,
		ERROR
	}

	public static final StepResult CONTINUE = new StepResult (Type.CONTINUE, -1);
	public static final StepResult END = new StepResult (Type.END, -1);
	public static final StepResult ERROR = new StepResult (Type.ERROR, -1);

	public final Type type;

	/** Statement index for {@link Type#JUMP}, otherwise -1 */
	public final int target;

	private StepResult (Type type, int target) {
		this.type = type;
		this.target = target;
	}

	public static StepResult jump (int target) {
		return new StepResult (Type.JUMP, target);
	}

	@Override
	public String toString () {
		return type == Type.JUMP ? "jump:" + target : type.toString ().toLowerCase ();
	}
}
