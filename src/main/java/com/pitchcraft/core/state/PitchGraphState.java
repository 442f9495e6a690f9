package com.pitchcraft.core.state;

import com.pitchcraft.core.graph.ResumeCommand;
import com.pitchcraft.core.model.PitchState;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.Map;

/**
 * LangGraph4j state for one pitch workflow run.
 * <p>
 * The whole typed {@link PitchState} travels in a single channel and is
 * replaced wholesale by every node; the command channel tells the entry node
 * which branch to take.
 */
public class PitchGraphState extends AgentState {

    public static final String PITCH_STATE = "pitchState";
    public static final String COMMAND = "command";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
        PITCH_STATE, Channels.base((Reducer<PitchState>) null),
        COMMAND,     Channels.base(() -> ResumeCommand.START.name())
    );

    public PitchGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> inputs(PitchState state, ResumeCommand command) {
        return Map.of(PITCH_STATE, state, COMMAND, command.name());
    }

    public static Map<String, Object> update(PitchState state) {
        return Map.of(PITCH_STATE, state);
    }

    public PitchState pitchState() {
        return this.<PitchState>value(PITCH_STATE)
                .orElseThrow(() -> new IllegalStateException("Graph state carries no pitch state"));
    }

    public ResumeCommand command() {
        String raw = this.<String>value(COMMAND).orElse(ResumeCommand.START.name());
        return ResumeCommand.valueOf(raw);
    }
}
