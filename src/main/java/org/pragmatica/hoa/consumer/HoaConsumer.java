package org.pragmatica.hoa.consumer;

import io.vavr.control.Option;
import org.pragmatica.hoa.tree.AccNameInfo;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.BooleanExpression;

import java.util.List;

/**
 * Receiver of parse events, called synchronously in input order.
 *
 * <p>Events already delivered are not retracted when parsing fails later;
 * implementations that build state must be prepared to discard it.
 */
public interface HoaConsumer {

    void notifyHeaderStart(String version);

    void setNumberOfStates(int count);

    /**
     * Called once per {@code Start:} header.
     */
    void addStartStates(List<Integer> states);

    void setAps(List<String> names);

    void addAlias(String name, BooleanExpression expression);

    void setAcceptanceCondition(int setCount, AcceptanceCondition condition);

    void provideAcceptanceName(String name, List<AccNameInfo> extraInfo);

    void setTool(List<String> info);

    void setName(String name);

    void addProperties(List<String> properties);

    /**
     * Called after {@code --BODY--}.
     */
    default void notifyBodyStart() {
    }

    void addState(int number, Option<String> name, Option<BooleanExpression> label, Option<List<Integer>> accSignature);

    void addEdgeWithLabel(int state, BooleanExpression label, List<Integer> targets, Option<List<Integer>> accSignature);

    void addEdgeImplicit(int state, List<Integer> targets, Option<List<Integer>> accSignature);

    void notifyEndOfState(int state);

    /**
     * Called after {@code --END--} and the end of input were both seen.
     */
    default void notifyEnd() {
    }

    /**
     * Called when {@code --ABORT--} is encountered; parsing fails right after.
     */
    default void notifyAbort() {
    }
}
