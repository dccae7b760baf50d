package markbridge.eval;

/**
 * Runtime value of the evaluated Typst subset.
 */
public sealed interface Value permits NoneValue, AutoValue, BoolValue, NumberValue, StrValue, ArrayValue, RangeValue,
		DictValue, ContentValue, FunctionValue, LabelValue, LengthValue, AlignValue, ColorValue, CellValue, RuleValue,
		HeaderValue, UnresolvedValue {
	String typeName();
}
