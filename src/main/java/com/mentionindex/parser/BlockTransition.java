package com.mentionindex.parser;

import java.util.Optional;

public record BlockTransition(BlockState next, Optional<CompletedBlock> completed) {

    static BlockTransition to(BlockState next) {
        return new BlockTransition(next, Optional.empty());
    }

    static BlockTransition commit(CompletedBlock block) {
        return new BlockTransition(BlockState.IDLE, Optional.of(block));
    }
}
