package playground.report;

import org.json.JSONArray;
import org.json.JSONObject;

import playground.parser.TreeNode;
import playground.parser.TreeVisitor;
import playground.parser.ll.Derivation;
import playground.parser.ll.ParseStep;

/**
 * Renders a {@link Derivation} as JSON or as plain text.
 */
public class DerivationReport {

	private final Derivation derivation;

	public DerivationReport(Derivation derivation) {
		this.derivation = derivation;
	}

	/**
	 * Tree node as {@code {symbol, isTerminal, children, value?, production?}}
	 */
	public static JSONObject treeToJson(TreeNode root){
		return root.accept(new TreeVisitor<JSONObject>() {
			@Override
			public JSONObject visitNonTerminal(TreeNode node) {
				JSONObject json = base(node);
				if (node.getProduction() != null){
					json.put("production", node.getProduction().intValue());
				}
				return json;
			}

			@Override
			public JSONObject visitTerminal(TreeNode node) {
				JSONObject json = base(node);
				if (node.hasValue()){
					json.put("value", node.getValue());
				}
				return json;
			}

			@Override
			public JSONObject visitEpsilon(TreeNode node) {
				return base(node);
			}

			private JSONObject base(TreeNode node){
				JSONArray children = new JSONArray();
				for (TreeNode child : node.children()){
					children.put(child.accept(this));
				}
				return new JSONObject()
						.put("symbol", node.symbol)
						.put("isTerminal", node.isTerminal())
						.put("children", children);
			}
		});
	}

	public static JSONObject stepToJson(ParseStep step){
		return new JSONObject()
				.put("step", step.step)
				.put("stack", new JSONArray(step.stack))
				.put("input", new JSONArray(step.input))
				.put("action", step.action);
	}

	public JSONObject toJson(){
		JSONArray steps = new JSONArray();
		for (ParseStep step : derivation.steps){
			steps.put(stepToJson(step));
		}
		JSONObject json = new JSONObject()
				.put("success", derivation.isAccepted())
				.put("steps", steps);
		if (derivation.isAccepted()){
			json.put("tree", treeToJson(derivation.getTree()));
		} else {
			json.put("error", derivation.getError());
		}
		return json;
	}

	public String toText(boolean withTrace){
		StringBuilder builder = new StringBuilder();
		if (withTrace){
			for (ParseStep step : derivation.steps){
				builder.append(step).append("\n");
			}
		}
		if (derivation.isAccepted()){
			builder.append("Accepted, derivation tree:\n").append(derivation.getTree().toPrettyString()).append("\n");
		} else {
			builder.append("Rejected: ").append(derivation.getError()).append("\n");
		}
		return builder.toString();
	}
}
