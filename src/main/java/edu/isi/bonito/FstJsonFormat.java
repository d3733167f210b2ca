package edu.isi.bonito;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact interchange form, one JSON document:
 * <pre>
 * { "version": 1,
 *   "graph": [ { "input label": [[dest, output id, weight], ...], ... }, ... ],
 *   "isymbol_dict": { "input label": id, ... },
 *   "osymbols": [ "output label" or null, ... ],
 *   "final_weights": [[state, weight], ...] }
 * </pre>
 * graph is indexed by source state. Output labels may also be given as strings, in which
 * case osymbols may be absent. Disambiguation outputs are always written as strings.
 */
public class FstJsonFormat {
	public static final int VERSION = 1;

	private static final ObjectMapper mapper = new ObjectMapper();

	public static void write(Fst fst, Writer w) throws IOException {
		ObjectNode root = mapper.createObjectNode();
		root.put("version", VERSION);

		SymbolTable isyms = fst.getInputSymbols();
		SymbolTable osyms = fst.getOutputSymbols();

		ArrayNode graph = root.putArray("graph");
		for (int s = 0; s < fst.getNumStates(); s++) {
			// group by input label, keeping first-seen order
			Map<String, ArrayNode> byLabel = new LinkedHashMap<String, ArrayNode>();
			for (Arc a : fst.arcs(s)) {
				String label = a.getInput().getLabel();
				ArrayNode l = byLabel.get(label);
				if (l == null) {
					l = mapper.createArrayNode();
					byLabel.put(label, l);
				}
				ArrayNode arc = l.addArray();
				arc.add(a.getDest());
				int oid = osyms.find(a.getOutput());
				if (oid >= Symbol.DISAMBIG_BASE)
					arc.add(a.getOutput().getLabel());
				else
					arc.add(oid);
				arc.add(a.getWeight());
			}
			ObjectNode state = graph.addObject();
			for (Map.Entry<String, ArrayNode> e : byLabel.entrySet())
				state.set(e.getKey(), e.getValue());
		}

		ObjectNode dict = root.putObject("isymbol_dict");
		int[] ids = isyms.ids();
		for (int i = 0; i < ids.length; i++)
			dict.put(isyms.get(ids[i]).getLabel(), ids[i]);

		ArrayNode olist = root.putArray("osymbols");
		ids = osyms.ids();
		int next = 0;
		for (int i = 0; i < ids.length && ids[i] < Symbol.DISAMBIG_BASE; i++) {
			for (; next < ids[i]; next++)
				olist.addNull();
			olist.add(osyms.get(ids[i]).getLabel());
			next++;
		}

		ArrayNode finals = root.putArray("final_weights");
		int[] f = fst.getFinalStates();
		for (int i = 0; i < f.length; i++) {
			ArrayNode pair = finals.addArray();
			pair.add(f[i]);
			pair.add(fst.finalWeight(f[i]).getAsDouble());
		}

		w.write(mapper.writeValueAsString(root));
		w.flush();
	}

	public static Fst read(Reader r) throws IOException, DataFormatException {
		boolean debug = false;
		JsonNode root;
		try {
			root = mapper.readTree(r);
		}
		catch (JsonProcessingException e) {
			throw new DataFormatException("Malformed JSON transducer: "+e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject())
			throw new DataFormatException("JSON transducer must be an object");
		JsonNode version = root.get("version");
		if (version == null || !version.isInt() || version.asInt() != VERSION)
			throw new DataFormatException("Unsupported JSON transducer version "+version);

		SymbolTable isyms = new SymbolTable();
		JsonNode dict = require(root, "isymbol_dict", true);
		Iterator<Map.Entry<String, JsonNode>> it = dict.fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> e = it.next();
			if (!e.getValue().isInt())
				throw new DataFormatException("isymbol_dict: id of "+e.getKey()+" is not an integer");
			isyms.define(parseLabel(e.getKey()), e.getValue().asInt(), true);
		}

		SymbolTable osyms = new SymbolTable();
		JsonNode olist = root.get("osymbols");
		if (olist != null && !olist.isNull()) {
			if (!olist.isArray())
				throw new DataFormatException("osymbols must be an array");
			for (int i = 0; i < olist.size(); i++) {
				JsonNode label = olist.get(i);
				if (label.isNull())
					continue;
				if (!label.isTextual())
					throw new DataFormatException("osymbols["+i+"] is not a string");
				osyms.define(parseLabel(label.asText()), i, false);
			}
		}

		MutableFst m = new MutableFst(isyms, osyms);
		JsonNode graph = require(root, "graph", false);
		if (graph.size() > 0)
			m.ensureState(graph.size()-1);
		for (int s = 0; s < graph.size(); s++) {
			JsonNode state = graph.get(s);
			if (!state.isObject())
				throw new DataFormatException("graph["+s+"] is not an object");
			Iterator<Map.Entry<String, JsonNode>> labels = state.fields();
			while (labels.hasNext()) {
				Map.Entry<String, JsonNode> e = labels.next();
				Symbol in = parseLabel(e.getKey());
				if (!isyms.contains(in))
					throw new DataFormatException("graph["+s+"]: input label "+e.getKey()+" not in isymbol_dict");
				if (!e.getValue().isArray())
					throw new DataFormatException("graph["+s+"]["+e.getKey()+"] is not an array");
				for (JsonNode arc : e.getValue()) {
					if (!arc.isArray() || arc.size() != 3 || !arc.get(0).isInt() || !arc.get(2).isNumber())
						throw new DataFormatException("graph["+s+"]["+e.getKey()+"]: bad arc "+arc);
					int dest = arc.get(0).asInt();
					if (dest < 0)
						throw new DataFormatException("graph["+s+"]: negative destination "+dest);
					Symbol out = outputSymbol(osyms, arc.get(1));
					m.ensureState(dest);
					m.addArc(s, dest, in, out, arc.get(2).asDouble());
				}
			}
		}

		JsonNode finals = require(root, "final_weights", false);
		for (JsonNode pair : finals) {
			if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isInt() || !pair.get(1).isNumber())
				throw new DataFormatException("final_weights: bad entry "+pair);
			int s = pair.get(0).asInt();
			if (s < 0)
				throw new DataFormatException("final_weights: negative state "+s);
			m.ensureState(s);
			m.setFinal(s, pair.get(1).asDouble());
		}
		if (debug) Debug.debug(debug, "Read "+m.getNumStates()+" states from JSON");
		return m.toFst();
	}

	private static JsonNode require(JsonNode root, String field, boolean object) throws DataFormatException {
		JsonNode n = root.get(field);
		if (n == null || (object ? !n.isObject() : !n.isArray()))
			throw new DataFormatException("JSON transducer lacks "+(object ? "object " : "array ")+field);
		return n;
	}

	private static Symbol parseLabel(String label) throws DataFormatException {
		if (label.length() == 0)
			throw new DataFormatException("empty symbol label");
		return Symbol.parse(label);
	}

	private static Symbol outputSymbol(SymbolTable osyms, JsonNode n) throws DataFormatException {
		if (n.isInt()) {
			Symbol sym = osyms.get(n.asInt());
			if (sym == null)
				throw new DataFormatException("unknown output label id "+n.asInt());
			return sym;
		}
		if (n.isTextual()) {
			return parseLabel(n.asText());
		}
		throw new DataFormatException("bad output label "+n);
	}
}
