package history;

import org.apache.commons.lang3.StringUtils;

import lombok.Data;

@Data
public class Operation {
	public enum OperationKind {
		READ('R'), WRITE('W'), COMMIT('C'), ABORT('A');

		private final char code;

		OperationKind(char code) {
			this.code = code;
		}

		public char getCode() {
			return code;
		}

		public boolean isTermination() {
			return this == COMMIT || this == ABORT;
		}

		public static OperationKind fromCode(String code) {
			if (code != null && code.length() == 1) {
				var c = Character.toUpperCase(code.charAt(0));
				for (var kind : values()) {
					if (kind.code == c) {
						return kind;
					}
				}
			}
			throw new InvalidOperationException(String.format("unknown operation kind '%s'", code));
		}
	}

	private final String transactionId;
	private final OperationKind kind;

	// empty for commit and abort
	private final String dataItem;

	public Operation(String transactionId, OperationKind kind, String dataItem) {
		if (StringUtils.isEmpty(transactionId)) {
			throw new InvalidOperationException("operation without transaction id");
		}
		if (kind == null) {
			throw new InvalidOperationException(
					String.format("operation of transaction %s has no kind", transactionId));
		}
		if (!kind.isTermination() && StringUtils.isEmpty(dataItem)) {
			throw new MissingDataItemException(transactionId, kind);
		}

		this.transactionId = transactionId;
		this.kind = kind;
		this.dataItem = kind.isTermination() ? "" : dataItem;
	}

	public static Operation read(String transactionId, String dataItem) {
		return new Operation(transactionId, OperationKind.READ, dataItem);
	}

	public static Operation write(String transactionId, String dataItem) {
		return new Operation(transactionId, OperationKind.WRITE, dataItem);
	}

	public static Operation commit(String transactionId) {
		return new Operation(transactionId, OperationKind.COMMIT, "");
	}

	public static Operation abort(String transactionId) {
		return new Operation(transactionId, OperationKind.ABORT, "");
	}

	public static Operation of(String transactionId, String code, String dataItem) {
		return new Operation(transactionId, OperationKind.fromCode(code), dataItem);
	}

	/**
	 * Two operations conflict if they come from different transactions, access the same data item
	 * and at least one of them writes it.
	 */
	public boolean conflictsWith(Operation other) {
		if (kind.isTermination() || other.kind.isTermination()) {
			return false;
		}

		return !transactionId.equals(other.transactionId) && dataItem.equals(other.dataItem)
				&& (kind == OperationKind.WRITE || other.kind == OperationKind.WRITE);
	}

	@Override
	public String toString() {
		if (kind.isTermination()) {
			return String.format("%s(%s)", kind.getCode(), transactionId);
		}
		return String.format("%s(%s,%s)", kind.getCode(), transactionId, dataItem);
	}
}
