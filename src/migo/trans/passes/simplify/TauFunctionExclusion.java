package migo.trans.passes.simplify;

import migo.model.Function;

/**
 * Which functions tau-function reduction must keep even if they reduce to tau.
 */
public abstract class TauFunctionExclusion {

	public abstract boolean isExcluded(Function f);

	public static TauFunctionExclusion none() {
		return new TauFunctionExclusion() {
			@Override
			public boolean isExcluded(Function f) {
				return false;
			}
		};
	}

	public static TauFunctionExclusion except(Function root) {
		String rootName = root.getName();
		return new TauFunctionExclusion() {
			@Override
			public boolean isExcluded(Function f) {
				return f.getName().equals(rootName);
			}
		};
	}
}
